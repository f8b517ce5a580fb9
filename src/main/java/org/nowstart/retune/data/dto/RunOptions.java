package org.nowstart.retune.data.dto;

public record RunOptions(
        boolean force,
        boolean dryRun
) {
}
