package org.nowstart.retune.data.dto;

import org.nowstart.retune.data.type.DriftSeverity;

public record DriftSignal(
        Double pValue,
        DriftSeverity severity
) {
}
