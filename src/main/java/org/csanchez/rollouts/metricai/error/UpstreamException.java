package org.csanchez.rollouts.metricai.error;

/**
 * A call to the model API could not be completed.
 */
public abstract class UpstreamException extends AnalysisException {

	private final int attempts;

	protected UpstreamException(String message, int attempts, Throwable cause) {
		super(message, cause);
		this.attempts = attempts;
	}

	/**
	 * Number of attempts made before giving up
	 */
	public int getAttempts() {
		return attempts;
	}
}
