package org.csanchez.rollouts.metricai.k8s;

/**
 * Source of pod logs for the analysis.
 */
public interface LogFetcher {

	/**
	 * Logs of the first pod matching {@code labelSelector}.
	 *
	 * @throws PodsNotFoundException when no pod matches
	 */
	String fetchFirstPodLogs(String namespace, String labelSelector);
}
