package org.nowstart.retune.service.signal;

import feign.FeignException;
import lombok.RequiredArgsConstructor;
import org.nowstart.retune.data.dto.DriftSignal;
import org.nowstart.retune.data.exception.SignalUnavailableException;
import org.nowstart.retune.repository.ForecastServiceFeignClient;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RemoteDriftDetector implements DriftDetector {

    private final ForecastServiceFeignClient forecastServiceFeignClient;

    @Override
    public DriftSignal detect(String horizon) {
        DriftSignal signal;
        try {
            signal = forecastServiceFeignClient.getDrift(horizon);
        } catch (FeignException e) {
            throw new SignalUnavailableException("drift", horizon, e);
        }
        if (signal == null || signal.pValue() == null || signal.severity() == null) {
            throw new SignalUnavailableException("drift", horizon, "empty response");
        }
        return signal;
    }
}
