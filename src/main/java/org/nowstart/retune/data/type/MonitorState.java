package org.nowstart.retune.data.type;

public enum MonitorState {
    OBSERVING,
    DEGRADED,
    PASSED,
    ROLLED_BACK,
    ROLLBACK_FAILED,
    INTERRUPTED
}
