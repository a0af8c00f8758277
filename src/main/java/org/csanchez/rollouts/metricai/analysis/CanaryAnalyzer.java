package org.csanchez.rollouts.metricai.analysis;

import org.csanchez.rollouts.metricai.retry.CancellationSignal;

/**
 * One way of turning stable and canary logs into a decision.
 */
public interface CanaryAnalyzer {

	AnalysisOutcome analyze(AnalysisInput input, CancellationSignal signal);
}
