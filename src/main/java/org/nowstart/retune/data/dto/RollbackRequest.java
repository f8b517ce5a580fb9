package org.nowstart.retune.data.dto;

import jakarta.validation.constraints.Size;

public record RollbackRequest(
        @Size(max = 500, message = "reason must be at most 500 characters") String reason
) {
}
