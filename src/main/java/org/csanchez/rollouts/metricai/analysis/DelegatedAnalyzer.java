package org.csanchez.rollouts.metricai.analysis;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.csanchez.rollouts.metricai.a2a.A2AResponse;
import org.csanchez.rollouts.metricai.a2a.DelegateClient;
import org.csanchez.rollouts.metricai.a2a.LogSplitter;
import org.csanchez.rollouts.metricai.error.AnalysisException;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delegates the analysis to the Kubernetes agent. Failures propagate as they are.
 */
public class DelegatedAnalyzer implements CanaryAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(DelegatedAnalyzer.class);
	private static final ObjectMapper objectMapper = new ObjectMapper();

	private final DelegateClient delegateClient;

	public DelegatedAnalyzer(DelegateClient delegateClient) {
		this.delegateClient = delegateClient;
	}

	@Override
	public AnalysisOutcome analyze(AnalysisInput input, CancellationSignal signal) {
		logger.info("Using Kubernetes Agent at {} for analysis", delegateClient.getBaseUrl());

		try {
			delegateClient.healthCheck(signal);
		} catch (AnalysisException e) {
			logger.error("Kubernetes Agent health check failed: {}", e.getMessage());
			throw e;
		}

		LogSplitter.SplitLogs logs = LogSplitter.split(input.getLogContext());

		A2AResponse response;
		try {
			response = delegateClient.analyze(input.getNamespace(), input.getTargetIdentifier(),
					logs.stableLogs(), logs.canaryLogs(), signal);
		} catch (AnalysisException e) {
			logger.error("Failed to analyze with Kubernetes Agent: {}", e.getMessage());
			throw e;
		}

		DecisionRecord decision = toDecision(response);
		if (decision.getChangeLink() != null) {
			logger.info("Agent created a PR with fix: {}", decision.getChangeLink());
		}
		logger.info("Analysis completed via Kubernetes Agent: promote={}, confidence={}",
				decision.isPromote(), decision.getConfidence());

		return new AnalysisOutcome(toRawText(decision), decision);
	}

	static DecisionRecord toDecision(A2AResponse response) {
		DecisionRecord decision = new DecisionRecord(response.getAnalysis(), response.isPromote(),
				response.getConfidence());
		decision.setRootCause(response.getRootCause() == null ? "" : response.getRootCause());
		decision.setRemediationSummary(response.getRemediation() == null ? "" : response.getRemediation());
		if (response.hasPrLink()) {
			decision.setChangeLink(response.getPrLink());
		}
		return decision;
	}

	private static String toRawText(DecisionRecord decision) {
		try {
			return objectMapper.writeValueAsString(decision);
		} catch (JsonProcessingException e) {
			throw new AnalysisException("failed to serialize agent analysis: " + e.getOriginalMessage(), e);
		}
	}
}
