package org.nowstart.retune.data.dto;

public record Hyperparameters(
        int contextLength,
        int numSamples,
        double temperature
) {
}
