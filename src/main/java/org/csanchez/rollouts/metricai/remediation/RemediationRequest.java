package org.csanchez.rollouts.metricai.remediation;

import org.csanchez.rollouts.metricai.analysis.RepositoryCoordinates;

/**
 * What a failure report is built from.
 */
public record RemediationRequest(String logContext, String analysis, RepositoryCoordinates repository,
		String modelIdentifier) {
}
