package org.csanchez.rollouts.metricai.k8s;

import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnableKubernetesMockClient(crud = true)
class K8sPodClientTest {

	KubernetesClient client;

	private K8sPodClient podClient;

	@BeforeEach
	void setUp() {
		podClient = new K8sPodClient(client);
	}

	private void createPod(String name, String role, String templateHash) {
		Pod pod = new PodBuilder()
				.withNewMetadata()
				.withName(name)
				.withNamespace("rollouts-demo")
				.addToLabels("role", role)
				.addToLabels(PodNameResolver.TEMPLATE_HASH_LABEL, templateHash)
				.endMetadata()
				.build();
		client.pods().inNamespace("rollouts-demo").resource(pod).create();
	}

	@Test
	void resolvesTemplateHashToPodName() {
		createPod("canary-demo-7d9f8b6c4-abcde", "canary", "7d9f8b6c4");
		createPod("canary-demo-5c6d7e8f9-vwxyz", "stable", "5c6d7e8f9");

		assertThat(podClient.resolveTemplateHash("rollouts-demo", "7d9f8b6c4"))
				.isEqualTo("canary-demo-7d9f8b6c4-abcde");
	}

	@Test
	void unknownTemplateHashIsNotFound() {
		createPod("canary-demo-7d9f8b6c4-abcde", "canary", "7d9f8b6c4");

		assertThatThrownBy(() -> podClient.resolveTemplateHash("rollouts-demo", "0000000"))
				.isInstanceOf(PodsNotFoundException.class)
				.hasMessageContaining(PodNameResolver.TEMPLATE_HASH_LABEL + "=0000000");
	}

	@Test
	void logsOfMissingPodsAreNotFound() {
		assertThatThrownBy(() -> podClient.fetchFirstPodLogs("rollouts-demo", "role=canary"))
				.isInstanceOf(PodsNotFoundException.class)
				.hasMessageContaining("role=canary");
	}

	@Test
	void recognisesBareTemplateHashes() {
		assertThat(PodNameResolver.looksLikeTemplateHash("7d9f8b6c4")).isTrue();
		assertThat(PodNameResolver.looksLikeTemplateHash("canary-demo-7d9f8b6c4-abcde")).isFalse();
		assertThat(PodNameResolver.looksLikeTemplateHash("")).isFalse();
		assertThat(PodNameResolver.looksLikeTemplateHash(null)).isFalse();
	}
}
