package org.nowstart.retune.data.type;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TriggerReason {
    PERFORMANCE_DEGRADATION("performance_degradation"),
    DATA_DRIFT("data_drift"),
    TIME_FALLBACK("time_fallback"),
    INITIAL_OPTIMIZATION("initial_optimization");

    private final String code;

    TriggerReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
