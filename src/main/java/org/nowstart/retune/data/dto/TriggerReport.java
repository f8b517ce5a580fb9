package org.nowstart.retune.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.retune.data.type.DriftSeverity;
import org.nowstart.retune.data.type.TriggerReason;

public record TriggerReport(
        String horizon,
        boolean shouldOptimize,
        List<TriggerReason> reasons,
        Instant evaluatedAt,
        Double performanceDegradationPct,
        Double driftPValue,
        DriftSeverity driftSeverity,
        Long daysSinceLastOptimization,
        List<String> warnings,
        boolean skipped
) {
}
