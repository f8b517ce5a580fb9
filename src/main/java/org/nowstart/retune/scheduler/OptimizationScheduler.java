package org.nowstart.retune.scheduler;

import lombok.RequiredArgsConstructor;
import org.nowstart.retune.service.OptimizationPipelineService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class OptimizationScheduler {

    private final OptimizationPipelineService optimizationPipelineService;

    @Scheduled(fixedDelayString = "${retune.optimizer.interval:24h}", initialDelayString = "${retune.optimizer.initial-delay:1m}")
    public void run() {
        optimizationPipelineService.runCycle();
    }
}
