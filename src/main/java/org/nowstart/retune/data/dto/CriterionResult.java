package org.nowstart.retune.data.dto;

import org.nowstart.retune.data.type.ValidationCriterion;

/**
 * Outcome of one validation criterion. {@code margin} is positive when the criterion passed with room
 * to spare and negative when it missed; it is null when the value could not be computed.
 */
public record CriterionResult(
        ValidationCriterion criterion,
        Double observed,
        double threshold,
        boolean passed,
        Double margin,
        String detail
) {
}
