package org.nowstart.retune.data.dto;

public record HealthStatus(
        boolean healthy,
        String detail
) {
}
