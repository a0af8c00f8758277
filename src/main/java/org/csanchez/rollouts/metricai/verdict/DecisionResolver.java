package org.csanchez.rollouts.metricai.verdict;

import org.csanchez.rollouts.metricai.analysis.AnalysisInput;
import org.csanchez.rollouts.metricai.analysis.DecisionRecord;
import org.csanchez.rollouts.metricai.remediation.RemediationRequest;
import org.csanchez.rollouts.metricai.remediation.RemediationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a decision into a verdict and files a failure report when the canary is rejected.
 */
public class DecisionResolver {

	private static final Logger logger = LoggerFactory.getLogger(DecisionResolver.class);

	private final RemediationService remediationService;

	public DecisionResolver(RemediationService remediationService) {
		this.remediationService = remediationService;
	}

	/**
	 * Promote scores the confidence; fail always scores 0 and keeps the
	 * confidence only in the metadata.
	 */
	public Verdict resolve(DecisionRecord decision) {
		Map<String, String> metadata = new LinkedHashMap<>();
		metadata.put("analysis", decision.getNarrative());
		metadata.put("confidence", Integer.toString(decision.getConfidence()));
		putIfPresent(metadata, "rootCause", decision.getRootCause());
		putIfPresent(metadata, "remediation", decision.getRemediationSummary());
		putIfPresent(metadata, "prLink", decision.getChangeLink());

		if (decision.isPromote()) {
			logger.info("Canary promotion recommended by AI analysis");
			return Verdict.promote(decision.getConfidence(), metadata);
		}
		logger.info("Canary promotion not recommended");
		return Verdict.fail(metadata);
	}

	/**
	 * Reports a rejected canary. Failures are logged and never change the verdict.
	 */
	public void onFailure(AnalysisInput input, DecisionRecord decision) {
		logger.info("Attempting to report canary failure");
		try {
			remediationService.reportCanaryFailure(new RemediationRequest(
					input.getLogContext(),
					decision.getNarrative(),
					input.getRepository(),
					input.getModelIdentifier()));
		} catch (RuntimeException e) {
			logger.warn("Failed to report canary failure: {}", e.getMessage());
		}
	}

	/**
	 * {@link #resolve} followed by {@link #onFailure} when the verdict is FAIL
	 */
	public Verdict resolveAndReport(AnalysisInput input, DecisionRecord decision) {
		Verdict verdict = resolve(decision);
		if (verdict.getKind() == Verdict.Kind.FAIL) {
			onFailure(input, decision);
		}
		return verdict;
	}

	private static void putIfPresent(Map<String, String> metadata, String key, String value) {
		if (value != null && !value.isEmpty()) {
			metadata.put(key, value);
		}
	}
}
