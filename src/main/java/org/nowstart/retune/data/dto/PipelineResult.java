package org.nowstart.retune.data.dto;

import java.time.Instant;
import lombok.Builder;
import org.nowstart.retune.data.type.PipelineOutcome;

@Builder(toBuilder = true)
public record PipelineResult(
        String horizon,
        PipelineOutcome outcome,
        TriggerReport trigger,
        OptimizationRun run,
        ValidationReport validation,
        DeploymentRecord deployment,
        MonitorResult monitor,
        String detail,
        Instant startedAt,
        Instant finishedAt
) {
}
