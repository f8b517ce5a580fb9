package org.nowstart.retune.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "retune.optimizer")
public record OptimizerProperties(
        // horizons managed by the scheduled cycle
        @NotNull @DefaultValue({"7d", "15d", "30d", "90d"}) List<String> horizons,
        // delay between scheduled optimization cycles
        @NotNull @DefaultValue("24h") Duration interval,
        // horizons optimized concurrently within one cycle
        @Positive @DefaultValue("4") int parallelism,
        // stop after validation without deploying
        @DefaultValue("false") boolean dryRun,
        // root directory for active slots, staging files and backups
        @NotBlank @DefaultValue("./state/slots") String stateDir
) {

    public boolean manages(String horizon) {
        return horizon != null && horizons.contains(horizon);
    }
}
