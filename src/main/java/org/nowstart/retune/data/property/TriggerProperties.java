package org.nowstart.retune.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.nowstart.retune.data.type.DriftSeverity;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.optimizer.trigger")
public record TriggerProperties(
        // recent vs baseline error increase (%) that triggers a search
        @DecimalMin("0") @DefaultValue("15.0") double degradationThresholdPct,
        // drift test significance level
        @DecimalMin(value = "0", inclusive = false) @DecimalMax("1.0") @DefaultValue("0.05") double driftPValueThreshold,
        // lowest drift severity that counts as drift
        @NotNull @DefaultValue("MEDIUM") DriftSeverity minDriftSeverity,
        // maximum time between searches
        @NotNull @DefaultValue("14d") Duration fallbackInterval
) {
}
