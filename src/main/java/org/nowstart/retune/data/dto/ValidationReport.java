package org.nowstart.retune.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.retune.data.type.ValidationCriterion;

public record ValidationReport(
        ModelConfiguration candidate,
        ModelConfiguration baseline,
        List<CriterionResult> results,
        boolean approved,
        List<ValidationCriterion> rejectionReasons,
        Instant validatedAt
) {
}
