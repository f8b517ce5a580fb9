package org.nowstart.retune.data.dto;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.nowstart.retune.data.type.SearchCompletion;

public record OptimizationRun(
        String horizon,
        SearchSpace searchSpace,
        BacktestWindow window,
        List<CandidateEvaluation> evaluations,
        CandidateEvaluation bestCandidate,
        ModelConfiguration bestConfiguration,
        Duration duration,
        SearchCompletion completion
) {

    public Optional<ModelConfiguration> best() {
        return Optional.ofNullable(bestConfiguration);
    }

    public List<CandidateEvaluation> failures() {
        return evaluations.stream()
                .filter(evaluation -> !evaluation.isSucceeded())
                .toList();
    }
}
