package org.nowstart.retune.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.retune.data.type.PipelineOutcome;
import org.nowstart.retune.data.type.SearchCompletion;

public record OptimizationHistoryDto(
        Long id,
        String horizon,
        PipelineOutcome outcome,
        boolean success,
        List<String> triggerReasons,
        boolean searched,
        String bestConfigId,
        Double bestPrimaryError,
        int candidatesEvaluated,
        int candidatesFailed,
        SearchCompletion searchCompletion,
        Boolean approved,
        List<String> rejectionReasons,
        String detail,
        Instant startedAt,
        Instant finishedAt
) {
}
