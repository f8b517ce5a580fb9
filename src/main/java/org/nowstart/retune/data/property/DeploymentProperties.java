package org.nowstart.retune.data.property;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.optimizer.deployment")
public record DeploymentProperties(
        // backups kept per horizon, oldest pruned first
        @Positive @DefaultValue("5") int backupRetention
) {
}
