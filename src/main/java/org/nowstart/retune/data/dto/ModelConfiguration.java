package org.nowstart.retune.data.dto;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;

public record ModelConfiguration(
        String configId,
        String horizon,
        Hyperparameters hyperparameters,
        ForecastMetrics validationMetrics,
        int searchIterations,
        Instant createdAt
) {

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    public static ModelConfiguration create(
            String horizon,
            Hyperparameters hyperparameters,
            ForecastMetrics validationMetrics,
            int searchIterations,
            Instant createdAt
    ) {
        return new ModelConfiguration(
                buildConfigId(horizon, hyperparameters, createdAt),
                horizon,
                hyperparameters,
                validationMetrics,
                searchIterations,
                createdAt
        );
    }

    public ModelConfiguration withValidationMetrics(ForecastMetrics metrics) {
        return new ModelConfiguration(configId, horizon, hyperparameters, metrics, searchIterations, createdAt);
    }

    static String buildConfigId(String horizon, Hyperparameters hyperparameters, Instant createdAt) {
        String content = horizon
                + "|" + hyperparameters.contextLength()
                + "|" + hyperparameters.numSamples()
                + "|" + hyperparameters.temperature()
                + "|" + createdAt.toEpochMilli();
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
            return horizon + "-" + ID_TIMESTAMP.format(createdAt) + "-" + HexFormat.of().formatHex(digest, 0, 4);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
