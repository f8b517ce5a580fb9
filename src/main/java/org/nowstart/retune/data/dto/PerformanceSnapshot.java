package org.nowstart.retune.data.dto;

public record PerformanceSnapshot(
        Double recentError,
        Double baselineError,
        Integer recentWindowDays,
        Integer baselineWindowDays
) {
}
