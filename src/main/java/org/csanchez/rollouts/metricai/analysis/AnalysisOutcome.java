package org.csanchez.rollouts.metricai.analysis;

/**
 * Result of one analysis: the raw answer kept for audit, and the decision read from it.
 */
public record AnalysisOutcome(String rawText, DecisionRecord decision) {
}
