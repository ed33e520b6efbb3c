package com.healthtech.olap.etl.run;

import com.healthtech.olap.data.run.EtlRun;
import com.healthtech.olap.data.run.RunStatus;

import java.time.LocalDateTime;

/**
 * Closing summary of one run, written as a single JSON line.
 */
public record RunSummary(
    long runId,
    LocalDateTime runStart,
    LocalDateTime runEnd,
    Long durationSeconds,
    RunStatus status,
    Integer recordsProcessed,
    String phase,
    String errorMessage
) {

    public static RunSummary of(EtlRun run) {
        return new RunSummary(
            run.runId(), run.runStart(), run.runEnd(), run.durationSeconds(), run.status(), run.recordsProcessed(), run.phase(),
            run.errorMessage()
        );
    }
}
