package org.nowstart.retune.data.dto;

public record ForecastMetrics(
        Double primaryError,
        Double secondaryError,
        Double mae,
        Double stdDev,
        Double latencyMillis,
        Double ci95Coverage,
        Double meanSignedError
) {
}
