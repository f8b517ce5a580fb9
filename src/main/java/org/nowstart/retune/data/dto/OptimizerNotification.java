package org.nowstart.retune.data.dto;

import java.time.Instant;
import org.nowstart.retune.data.type.NotificationType;

public record OptimizerNotification(
        NotificationType type,
        String horizon,
        String message,
        Instant emittedAt
) {
}
