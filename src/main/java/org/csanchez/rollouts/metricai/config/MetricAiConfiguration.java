package org.csanchez.rollouts.metricai.config;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import okhttp3.OkHttpClient;
import org.csanchez.rollouts.metricai.a2a.A2AClient;
import org.csanchez.rollouts.metricai.a2a.DelegateClient;
import org.csanchez.rollouts.metricai.analysis.DelegatedAnalyzer;
import org.csanchez.rollouts.metricai.analysis.DirectModelAnalyzer;
import org.csanchez.rollouts.metricai.analysis.ModeDispatcher;
import org.csanchez.rollouts.metricai.k8s.K8sPodClient;
import org.csanchez.rollouts.metricai.measurement.CanaryMetricProvider;
import org.csanchez.rollouts.metricai.model.GeminiModelCaller;
import org.csanchez.rollouts.metricai.model.ModelCaller;
import org.csanchez.rollouts.metricai.remediation.GitHubIssueRemediation;
import org.csanchez.rollouts.metricai.remediation.GitHubRestClient;
import org.csanchez.rollouts.metricai.remediation.RemediationService;
import org.csanchez.rollouts.metricai.retry.RetryController;
import org.csanchez.rollouts.metricai.verdict.DecisionResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the analysis engine. Credentials and settings are read once here and
 * handed to each component through its constructor.
 */
@Configuration
public class MetricAiConfiguration {

	private static final Logger logger = LoggerFactory.getLogger(MetricAiConfiguration.class);

	@Bean
	public Credentials credentials(MetricAiProperties properties) {
		return SecretFileLoader.load(Path.of(properties.secretsDir()));
	}

	@Bean
	public OkHttpClient httpClient(MetricAiProperties properties) {
		return new OkHttpClient.Builder()
				.connectTimeout(properties.httpTimeout())
				.readTimeout(properties.httpTimeout())
				.writeTimeout(properties.httpTimeout())
				.build();
	}

	@Bean
	public ModelCaller modelCaller(OkHttpClient httpClient, MetricAiProperties properties, Credentials credentials) {
		return new GeminiModelCaller(httpClient, properties.geminiApiUrl(), credentials.googleApiKey());
	}

	@Bean
	public RetryController retryController(MetricAiProperties properties) {
		return new RetryController(properties.backoff().toIntervalFunction());
	}

	@Bean
	public DelegateClient delegateClient(OkHttpClient httpClient, MetricAiProperties properties) {
		logger.info("Kubernetes Agent URL: {}", properties.agentUrl());
		return new A2AClient(httpClient, properties.agentUrl(), properties.agentTimeout());
	}

	@Bean
	public ModeDispatcher modeDispatcher(ModelCaller modelCaller, RetryController retryController,
			DelegateClient delegateClient, MetricAiProperties properties) {
		return new ModeDispatcher(
				new DirectModelAnalyzer(modelCaller, retryController, properties.maxAttempts()),
				new DelegatedAnalyzer(delegateClient));
	}

	@Bean(destroyMethod = "close")
	public KubernetesClient kubernetesClient() {
		// in-cluster config first, then KUBECONFIG
		return new KubernetesClientBuilder().build();
	}

	@Bean
	public K8sPodClient podClient(KubernetesClient kubernetesClient) {
		return new K8sPodClient(kubernetesClient);
	}

	@Bean
	public RemediationService remediationService(OkHttpClient httpClient, MetricAiProperties properties,
			Credentials credentials) {
		return new GitHubIssueRemediation(
				new GitHubRestClient(httpClient, properties.githubApiUrl(), credentials.githubToken()));
	}

	@Bean
	public DecisionResolver decisionResolver(RemediationService remediationService) {
		return new DecisionResolver(remediationService);
	}

	@Bean
	public CanaryMetricProvider canaryMetricProvider(K8sPodClient podClient, ModeDispatcher modeDispatcher,
			DecisionResolver decisionResolver, MetricAiProperties properties) {
		CanaryMetricProvider.Defaults defaults = new CanaryMetricProvider.Defaults(
				properties.defaultModel(), properties.stableLabel(), properties.canaryLabel());
		logger.info("AI metric provider initialized with defaults: {}", defaults);
		return new CanaryMetricProvider(podClient, podClient, modeDispatcher, decisionResolver, defaults,
				Clock.systemUTC());
	}
}
