package org.csanchez.rollouts.metricai.error;

/**
 * The remote diagnostic agent could not be reached: connection refused, timeout or
 * another transport failure. A non-success HTTP answer is a plain {@link AnalysisException}.
 * Delegated mode never falls back to direct analysis when this happens.
 */
public class DelegateUnreachableException extends AnalysisException {

	public DelegateUnreachableException(String message) {
		super(message);
	}

	public DelegateUnreachableException(String message, Throwable cause) {
		super(message, cause);
	}
}
