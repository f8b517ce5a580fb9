package org.nowstart.retune.data.dto;

import java.time.Instant;

public record RunAcceptedDto(
        String horizon,
        boolean force,
        boolean dryRun,
        Instant acceptedAt
) {
}
