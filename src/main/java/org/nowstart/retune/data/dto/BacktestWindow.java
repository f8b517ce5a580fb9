package org.nowstart.retune.data.dto;

import java.time.Duration;
import java.time.Instant;

public record BacktestWindow(
        String horizon,
        Instant start,
        Instant end,
        int days
) {

    public static BacktestWindow endingAt(String horizon, Instant end, int days) {
        return new BacktestWindow(horizon, end.minus(Duration.ofDays(days)), end, days);
    }
}
