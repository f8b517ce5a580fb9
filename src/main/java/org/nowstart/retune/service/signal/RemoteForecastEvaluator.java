package org.nowstart.retune.service.signal;

import lombok.RequiredArgsConstructor;
import org.nowstart.retune.data.dto.BacktestRequest;
import org.nowstart.retune.data.dto.BacktestWindow;
import org.nowstart.retune.data.dto.ForecastMetrics;
import org.nowstart.retune.data.dto.Hyperparameters;
import org.nowstart.retune.repository.ForecastServiceFeignClient;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RemoteForecastEvaluator implements ForecastEvaluator {

    private final ForecastServiceFeignClient forecastServiceFeignClient;

    @Override
    public ForecastMetrics evaluate(Hyperparameters hyperparameters, BacktestWindow window) {
        return forecastServiceFeignClient.runBacktest(BacktestRequest.of(hyperparameters, window));
    }
}
