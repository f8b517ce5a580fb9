package org.nowstart.retune.data.dto;

import java.time.Instant;

public record BackupSnapshot(
        String horizon,
        long sequence,
        String configId,
        Instant createdAt,
        String reference
) {
}
