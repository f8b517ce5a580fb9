package org.nowstart.retune.data.dto;

import java.time.Instant;

public record BacktestRequest(
        String horizon,
        int contextLength,
        int numSamples,
        double temperature,
        Instant windowStart,
        Instant windowEnd,
        int windowDays
) {

    public static BacktestRequest of(Hyperparameters hyperparameters, BacktestWindow window) {
        return new BacktestRequest(
                window.horizon(),
                hyperparameters.contextLength(),
                hyperparameters.numSamples(),
                hyperparameters.temperature(),
                window.start(),
                window.end(),
                window.days()
        );
    }
}
