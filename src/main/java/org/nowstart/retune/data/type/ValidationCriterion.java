package org.nowstart.retune.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationCriterion {
    ACCURACY("accuracy"),
    STABILITY("stability"),
    LATENCY("latency"),
    COVERAGE("coverage"),
    BIAS("bias");

    private final String code;

    ValidationCriterion(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
