package org.nowstart.retune.data.type;

public enum PipelineOutcome {
    NO_OP,
    SKIPPED,
    BUSY,
    FAILED,
    REJECTED,
    DRY_RUN,
    DEPLOYED,
    ROLLED_BACK
}
