package org.nowstart.retune.data.type;

public enum ConfigStatus {
    ACTIVE,
    SUPERSEDED,
    ROLLED_BACK
}
