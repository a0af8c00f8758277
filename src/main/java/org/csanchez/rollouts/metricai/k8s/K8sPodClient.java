package org.csanchez.rollouts.metricai.k8s;

import io.fabric8.kubernetes.api.model.ListOptions;
import io.fabric8.kubernetes.api.model.ListOptionsBuilder;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Pod lookups against the cluster the provider runs in
 */
public class K8sPodClient implements LogFetcher, PodNameResolver {

	private static final Logger logger = LoggerFactory.getLogger(K8sPodClient.class);

	private final KubernetesClient k8sClient;

	public K8sPodClient(KubernetesClient k8sClient) {
		this.k8sClient = k8sClient;
	}

	@Override
	public String fetchFirstPodLogs(String namespace, String labelSelector) {
		Pod pod = firstPod(namespace, labelSelector);
		String podName = pod.getMetadata().getName();
		try {
			String logs = k8sClient.pods()
					.inNamespace(namespace)
					.withName(podName)
					.getLog();
			return logs == null ? "" : logs;
		} catch (KubernetesClientException e) {
			logger.error("Failed to fetch logs for pod {}/{}: {}", namespace, podName, e.getMessage());
			throw new KubernetesClientException(
					"failed to fetch logs for pod " + podName + " in namespace " + namespace + ": " + e.getMessage(), e);
		}
	}

	@Override
	public String resolveTemplateHash(String namespace, String templateHash) {
		logger.debug("Looking for pod with template hash {} in {}", templateHash, namespace);
		Pod pod = firstPod(namespace, TEMPLATE_HASH_LABEL + "=" + templateHash);
		String podName = pod.getMetadata().getName();
		logger.info("Resolved pod template hash {} to pod {}", templateHash, podName);
		return podName;
	}

	private Pod firstPod(String namespace, String labelSelector) {
		ListOptions options = new ListOptionsBuilder()
				.withLabelSelector(labelSelector)
				.build();
		List<Pod> pods = k8sClient.pods()
				.inNamespace(namespace)
				.list(options)
				.getItems();

		if (pods.isEmpty()) {
			logger.warn("No pods found for selector {} in namespace {}", labelSelector, namespace);
			throw new PodsNotFoundException(
					"no pods found for selector " + labelSelector + " in namespace " + namespace);
		}
		return pods.get(0);
	}
}
