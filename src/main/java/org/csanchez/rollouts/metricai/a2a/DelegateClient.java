package org.csanchez.rollouts.metricai.a2a;

import org.csanchez.rollouts.metricai.retry.CancellationSignal;

/**
 * Client side of the A2A protocol spoken by the remote diagnostic agent.
 */
public interface DelegateClient {

	/**
	 * Reachability probe. Any HTTP answer counts as healthy.
	 *
	 * @throws org.csanchez.rollouts.metricai.error.DelegateUnreachableException on transport failure
	 */
	void healthCheck(CancellationSignal signal);

	/**
	 * Asks the agent to analyse the canary identified by {@code namespace} and {@code podName}.
	 */
	A2AResponse analyze(String namespace, String podName, String stableLogs, String canaryLogs,
			CancellationSignal signal);

	String getBaseUrl();
}
