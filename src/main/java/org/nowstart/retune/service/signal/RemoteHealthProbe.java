package org.nowstart.retune.service.signal;

import lombok.RequiredArgsConstructor;
import org.nowstart.retune.data.dto.HealthStatus;
import org.nowstart.retune.repository.ForecastServiceFeignClient;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RemoteHealthProbe implements HealthProbe {

    private final ForecastServiceFeignClient forecastServiceFeignClient;

    @Override
    public HealthStatus check(String horizon) {
        HealthStatus status = forecastServiceFeignClient.getHealth(horizon);
        return status == null ? new HealthStatus(false, "empty health response") : status;
    }
}
