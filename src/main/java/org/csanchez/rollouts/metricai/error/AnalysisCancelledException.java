package org.csanchez.rollouts.metricai.error;

public class AnalysisCancelledException extends AnalysisException {

	public AnalysisCancelledException(String message) {
		super(message);
	}
}
