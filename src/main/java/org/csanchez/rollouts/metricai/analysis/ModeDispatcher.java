package org.csanchez.rollouts.metricai.analysis;

import org.csanchez.rollouts.metricai.error.AnalysisConfigurationException;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes an analysis to the direct or the delegated analyzer.
 *
 * <p>Delegated mode never falls back to direct mode: a delegated request with
 * missing inputs, or a delegate that cannot be reached, fails the analysis.
 */
public class ModeDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(ModeDispatcher.class);

	private final CanaryAnalyzer directAnalyzer;
	private final CanaryAnalyzer delegatedAnalyzer;

	public ModeDispatcher(CanaryAnalyzer directAnalyzer, CanaryAnalyzer delegatedAnalyzer) {
		this.directAnalyzer = directAnalyzer;
		this.delegatedAnalyzer = delegatedAnalyzer;
	}

	/**
	 * @throws AnalysisConfigurationException when delegated mode lacks a namespace or target
	 */
	public AnalysisOutcome dispatch(AnalysisMode mode, AnalysisInput input, CancellationSignal signal) {
		AnalysisMode selected = mode == null ? AnalysisMode.DIRECT : mode;
		logger.info("Analyzing with mode: {}, namespace: {}, target: {}",
				selected.getConfigValue(), input.getNamespace(), input.getTargetIdentifier());

		if (selected == AnalysisMode.DELEGATED) {
			requireDelegatedInputs(input.getNamespace(), input.getTargetIdentifier());
			return delegatedAnalyzer.analyze(input, signal);
		}
		return directAnalyzer.analyze(input, signal);
	}

	/**
	 * @throws AnalysisConfigurationException when either value is missing
	 */
	public static void requireDelegatedInputs(String namespace, String targetIdentifier) {
		if (namespace == null || namespace.isBlank() || targetIdentifier == null || targetIdentifier.isBlank()) {
			throw new AnalysisConfigurationException(
					"agent mode requires namespace and podName to be configured");
		}
	}
}
