package org.nowstart.retune.data.property;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.optimizer.monitor")
public record MonitorProperties(
        // observe health after each deployment
        @DefaultValue("true") boolean enabled,
        // observation window after a deployment
        @NotNull @DefaultValue("60m") Duration window,
        // delay between health probes
        @NotNull @DefaultValue("1m") Duration probeInterval,
        // consecutive failed probes that trigger a rollback
        @Positive @DefaultValue("3") int failureThreshold
) {
}
