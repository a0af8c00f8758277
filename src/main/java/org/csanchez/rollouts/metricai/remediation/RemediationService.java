package org.csanchez.rollouts.metricai.remediation;

/**
 * Files a report about a canary that should not be promoted.
 */
public interface RemediationService {

	/**
	 * @throws RemediationException when the report could not be filed
	 */
	void reportCanaryFailure(RemediationRequest request);
}
