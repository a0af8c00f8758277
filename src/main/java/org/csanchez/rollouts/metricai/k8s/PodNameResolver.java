package org.csanchez.rollouts.metricai.k8s;

/**
 * Resolves a rollout pod template hash to the name of a pod created from it.
 */
public interface PodNameResolver {

	String TEMPLATE_HASH_LABEL = "rollouts-pod-template-hash";

	/**
	 * @throws PodsNotFoundException when no pod carries the hash
	 */
	String resolveTemplateHash(String namespace, String templateHash);

	/**
	 * Pod names always contain a dash; a bare hash does not
	 */
	static boolean looksLikeTemplateHash(String target) {
		return target != null && !target.isEmpty() && !target.contains("-");
	}
}
