package org.nowstart.retune.data.dto;

import java.time.Instant;

public record HorizonStatusDto(
        String horizon,
        String activeConfigId,
        String ledgerConfigId,
        boolean consistent,
        int backupCount,
        Instant lastTransitionAt,
        boolean pipelineRunning
) {
}
