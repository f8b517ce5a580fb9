package org.nowstart.retune.data.type;

public enum DriftSeverity {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(DriftSeverity other) {
        return compareTo(other) >= 0;
    }
}
