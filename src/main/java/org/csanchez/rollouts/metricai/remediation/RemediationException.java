package org.csanchez.rollouts.metricai.remediation;

public class RemediationException extends RuntimeException {

	public RemediationException(String message) {
		super(message);
	}

	public RemediationException(String message, Throwable cause) {
		super(message, cause);
	}
}
