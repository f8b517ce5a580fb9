package org.nowstart.retune.data.dto;

import java.time.Duration;
import java.time.Instant;
import org.nowstart.retune.data.type.MonitorState;

public record MonitorResult(
        String horizon,
        MonitorState state,
        int probesPerformed,
        int probeFailures,
        int maxConsecutiveFailures,
        Instant startedAt,
        Instant finishedAt,
        Duration elapsed,
        DeploymentRecord rollback
) {
}
