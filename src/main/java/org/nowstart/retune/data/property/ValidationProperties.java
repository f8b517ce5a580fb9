package org.nowstart.retune.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.optimizer.validation")
public record ValidationProperties(
        // required primary error (RMSE) improvement in %
        @DecimalMin("0") @DefaultValue("5.0") double minPrimaryImprovementPct,
        // required secondary error (MAPE) improvement in %, alternative to the primary one
        @DecimalMin("0") @DefaultValue("3.0") double minSecondaryImprovementPct,
        // tolerated error std-dev increase in %
        @DecimalMin("0") @DefaultValue("10.0") double maxStdDevIncreasePct,
        // tolerated inference latency increase in %
        @DecimalMin("0") @DefaultValue("50.0") double maxLatencyIncreasePct,
        // minimum empirical 95% interval coverage
        @DecimalMin("0") @DecimalMax("1.0") @DefaultValue("0.90") double minCoverage,
        // absolute mean signed error must stay strictly below this
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("5.0") double maxAbsBias
) {
}
