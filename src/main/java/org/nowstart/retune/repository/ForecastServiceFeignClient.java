package org.nowstart.retune.repository;

import org.nowstart.retune.config.ForecastServiceFeignConfig;
import org.nowstart.retune.data.dto.BacktestRequest;
import org.nowstart.retune.data.dto.DriftSignal;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.HealthStatus;
import org.nowstart.retune.data.dto.PerformanceSnapshot;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;

@FeignClient(
        name = "forecastServiceClient",
        url = "${retune.forecast-service.base-url}",
        configuration = ForecastServiceFeignConfig.class
)
public interface ForecastServiceFeignClient {

    @PostMapping(value = "/v1/backtests", consumes = "application/json")
    ForecastMetrics runBacktest(@RequestBody BacktestRequest request);

    @GetMapping("/v1/horizons/{horizon}/performance")
    PerformanceSnapshot getPerformance(@PathVariable("horizon") String horizon);

    @GetMapping("/v1/horizons/{horizon}/drift")
    DriftSignal getDrift(@PathVariable("horizon") String horizon);

    @GetMapping("/v1/horizons/{horizon}/health")
    HealthStatus getHealth(@PathVariable("horizon") String horizon);
}
