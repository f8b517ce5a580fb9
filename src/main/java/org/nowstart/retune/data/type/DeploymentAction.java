package org.nowstart.retune.data.type;

public enum DeploymentAction {
    DEPLOY,
    ROLLBACK
}
