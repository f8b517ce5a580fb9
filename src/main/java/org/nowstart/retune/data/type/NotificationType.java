package org.nowstart.retune.data.type;

public enum NotificationType {
    OPTIMIZATION_TRIGGERED,
    VALIDATION_PASSED,
    VALIDATION_FAILED,
    DEPLOYMENT_SUCCEEDED,
    DEPLOYMENT_ROLLED_BACK,
    CYCLE_COMPLETED
}
