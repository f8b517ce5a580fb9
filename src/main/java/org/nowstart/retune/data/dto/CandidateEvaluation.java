package org.nowstart.retune.data.dto;

public record CandidateEvaluation(
        int index,
        Hyperparameters hyperparameters,
        ForecastMetrics metrics,
        String failureReason
) {

    public static CandidateEvaluation succeeded(int index, Hyperparameters hyperparameters, ForecastMetrics metrics) {
        return new CandidateEvaluation(index, hyperparameters, metrics, null);
    }

    public static CandidateEvaluation failed(int index, Hyperparameters hyperparameters, String failureReason) {
        return new CandidateEvaluation(index, hyperparameters, null, failureReason);
    }

    public boolean isSucceeded() {
        return failureReason == null && metrics != null;
    }
}
