package org.csanchez.rollouts.metricai.error;

/**
 * Base class for failures that abort a canary analysis.
 * The measurement layer maps these to an error measurement.
 */
public class AnalysisException extends RuntimeException {

	public AnalysisException(String message) {
		super(message);
	}

	public AnalysisException(String message, Throwable cause) {
		super(message, cause);
	}
}
