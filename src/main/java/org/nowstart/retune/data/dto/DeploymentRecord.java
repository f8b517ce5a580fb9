package org.nowstart.retune.data.dto;

import java.time.Instant;
import org.nowstart.retune.data.type.DeploymentAction;
import org.nowstart.retune.data.type.DeploymentOutcome;

public record DeploymentRecord(
        Long sequence,
        String horizon,
        DeploymentAction action,
        String deployedConfigId,
        String previousConfigId,
        String backupRef,
        Instant deployedAt,
        DeploymentOutcome outcome,
        String rollbackReason
) {
}
