package org.nowstart.retune.data.type;

public enum DeploymentOutcome {
    DEPLOYED,
    ROLLED_BACK
}
