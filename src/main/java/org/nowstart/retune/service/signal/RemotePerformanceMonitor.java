package org.nowstart.retune.service.signal;

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import org.nowstart.retune.data.dto.PerformanceSnapshot;
import org.nowstart.retune.data.exception.SignalUnavailableException;
import org.nowstart.retune.repository.ForecastServiceFeignClient;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RemotePerformanceMonitor implements PerformanceMonitor {

    private final ForecastServiceFeignClient forecastServiceFeignClient;

    @Override
    public PerformanceSnapshot fetch(String horizon) {
        PerformanceSnapshot snapshot;
        try {
            snapshot = forecastServiceFeignClient.getPerformance(horizon);
        } catch (FeignException e) {
            throw new SignalUnavailableException("performance", horizon, e);
        }
        if (snapshot == null || snapshot.recentError() == null || snapshot.baselineError() == null) {
            throw new SignalUnavailableException("performance", horizon, "empty response");
        }
        return snapshot;
    }
}
