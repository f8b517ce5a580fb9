package org.nowstart.retune.data.property;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.optimizer.search")
public record SearchProperties(
        // days of history in the backtest window
        @Positive @DefaultValue("30") int backtestWindowDays,
        // caller-side timeout for one candidate evaluation
        @NotNull @DefaultValue("60s") Duration candidateTimeout,
        // wall-clock ceiling for a full grid
        @NotNull @DefaultValue("10m") Duration maxRuntime,
        // candidates still evaluated once the ceiling is hit
        @Positive @DefaultValue("5") int fallbackSampleSize,
        // sample counts tried for every horizon
        @NotEmpty @DefaultValue({"50", "100", "200"}) List<Integer> numSamples,
        // sampling temperatures tried for every horizon
        @NotEmpty @DefaultValue({"0.8", "1.0", "1.2"}) List<Double> temperatures,
        // context lengths for horizons without an explicit entry
        @NotEmpty @DefaultValue("180") List<Integer> defaultContextLengths,
        // context lengths keyed by horizon
        @NotNull @DefaultValue Map<String, List<Integer>> contextLengths
) {
}
