package com.healthtech.olap.data.run;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * One row of etl_control. {@code phase} is kept as the stored string so rows written by older runs still read back.
 */
public record EtlRun(
    long runId,
    LocalDateTime runStart,
    LocalDateTime runEnd,
    RunStatus status,
    Integer recordsProcessed,
    String errorMessage,
    String phase
) {

    public Long durationSeconds() {
        if (runStart == null || runEnd == null) {
            return null;
        }
        return Duration.between(runStart, runEnd).getSeconds();
    }
}
