package com.healthtech.olap.exception;

/**
 * Thrown when a run is started while the control table still holds a RUNNING run.
 */
public class RunAlreadyInProgressException extends RuntimeException {

	private static final long serialVersionUID = 7781530429318851207L;

	private final long runningRunId;

	/**
	 * @param runningRunId the run that is still marked RUNNING in the control table
	 */
	public RunAlreadyInProgressException(long runningRunId) {
		super("ETL run " + runningRunId + " is still RUNNING. "
				+ "If that process is gone, mark the run FAILED in etl_control or disable etl.guard-concurrent-runs "
				+ "before starting a new full refresh.");
		this.runningRunId = runningRunId;
	}

	public long getRunningRunId() {
		return runningRunId;
	}
}
