package org.csanchez.rollouts.metricai.error;

/**
 * Required inputs for the selected analysis mode are missing. Never retried.
 */
public class AnalysisConfigurationException extends AnalysisException {

	public AnalysisConfigurationException(String message) {
		super(message);
	}
}
