package com.healthtech.olap.exception;

/**
 * Raised when a pipeline phase cannot complete. The run that raised it is recorded as FAILED and the documented recovery is a full
 * re-run, never a resume from the failed phase.
 */
public class EtlPhaseException extends RuntimeException {

	private static final long serialVersionUID = -4203318562904716571L;

	private final long runId;

	private final String phase;

	public EtlPhaseException(long runId, String phase, Throwable cause) {
		super("ETL run " + runId + " failed after phase " + phase + ": " + describe(cause), cause);
		this.runId = runId;
		this.phase = phase;
	}

	public long getRunId() {
		return runId;
	}

	public String getPhase() {
		return phase;
	}

	private static String describe(Throwable cause) {
		if (cause == null) {
			return "unknown error";
		}
		return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
	}
}
