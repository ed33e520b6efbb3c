package com.healthtech.olap.etl.run;

import com.healthtech.olap.data.run.EtlPhase;
import com.healthtech.olap.data.run.EtlRun;
import com.healthtech.olap.data.run.RunStatus;

import java.util.Optional;

/**
 * Records one row per pipeline execution. The run id returned by {@link #start()} is passed to every later call.
 */
public interface RunTracker {

    /**
     * Opens a RUNNING run at phase INITIALIZATION.
     *
     * @throws com.healthtech.olap.exception.RunAlreadyInProgressException if concurrent runs are guarded and one is RUNNING
     */
    long start();

    /**
     * Moves the run to {@code phase}. A null {@code recordsProcessed} keeps the count already recorded.
     */
    void advance(long runId, EtlPhase phase, Integer recordsProcessed);

    /**
     * Closes the run with an end timestamp and a terminal status. A successful run also moves to phase COMPLETED; a failed one keeps
     * the last phase it reached.
     */
    void complete(long runId, RunStatus status, String errorMessage);

    Optional<EtlRun> find(long runId);
}
