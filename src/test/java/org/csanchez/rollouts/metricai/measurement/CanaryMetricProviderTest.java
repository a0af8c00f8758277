package org.csanchez.rollouts.metricai.measurement;

import org.csanchez.rollouts.metricai.a2a.A2AResponse;
import org.csanchez.rollouts.metricai.a2a.DelegateClient;
import org.csanchez.rollouts.metricai.analysis.DelegatedAnalyzer;
import org.csanchez.rollouts.metricai.analysis.DirectModelAnalyzer;
import org.csanchez.rollouts.metricai.analysis.ModeDispatcher;
import org.csanchez.rollouts.metricai.k8s.LogFetcher;
import org.csanchez.rollouts.metricai.k8s.PodNameResolver;
import org.csanchez.rollouts.metricai.k8s.PodsNotFoundException;
import org.csanchez.rollouts.metricai.model.ModelApiException;
import org.csanchez.rollouts.metricai.model.ModelCaller;
import org.csanchez.rollouts.metricai.model.ModelResponse;
import org.csanchez.rollouts.metricai.remediation.RemediationRequest;
import org.csanchez.rollouts.metricai.remediation.RemediationService;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.csanchez.rollouts.metricai.retry.RetryController;
import org.csanchez.rollouts.metricai.verdict.DecisionResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CanaryMetricProviderTest {

	private static final Instant NOW = Instant.parse("2025-01-15T10:00:00Z");

	@Mock
	private LogFetcher logFetcher;

	@Mock
	private PodNameResolver podNameResolver;

	@Mock
	private DelegateClient delegateClient;

	@Mock
	private RemediationService remediationService;

	private final AtomicReference<String> modelAnswer = new AtomicReference<>();
	private final AtomicInteger modelCalls = new AtomicInteger();
	private ModelCaller modelCaller = (model, segments, signal) -> {
		modelCalls.incrementAndGet();
		return ModelResponse.ofText(modelAnswer.get());
	};

	private CanaryMetricProvider provider;

	@BeforeEach
	void setUp() {
		provider = newProvider();
	}

	private CanaryMetricProvider newProvider() {
		RetryController retryController = new RetryController(RetryController.defaultBackoff(), (wait, signal) -> {
		});
		ModeDispatcher dispatcher = new ModeDispatcher(
				new DirectModelAnalyzer((model, segments, signal) -> modelCaller.generate(model, segments, signal),
						retryController, RetryController.DEFAULT_MAX_ATTEMPTS),
				new DelegatedAnalyzer(delegateClient));
		return new CanaryMetricProvider(logFetcher, podNameResolver, dispatcher,
				new DecisionResolver(remediationService),
				new CanaryMetricProvider.Defaults("gemini-2.0-flash", "role=stable", "role=canary"),
				Clock.fixed(NOW, ZoneOffset.UTC));
	}

	private static MetricRunRequest request(MetricPluginConfig config) {
		return new MetricRunRequest("canary-demo-analysis", "rollouts-demo", "ai-analysis", config);
	}

	private void givenLogs() {
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "role=stable")).thenReturn("INFO all good");
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "role=canary")).thenReturn("INFO all good too");
	}

	@Test
	void healthyCanaryIsSuccessfulWithConfidenceScore() {
		givenLogs();
		modelAnswer.set("{\"text\":\"No errors in either version\",\"promote\":true,\"confidence\":85}");

		Measurement measurement = provider.run(request(new MetricPluginConfig()), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.SUCCESSFUL);
		assertThat(measurement.getValue()).isEqualTo("0.85");
		assertThat(measurement.getMetadata())
				.containsEntry("analysis", "No errors in either version")
				.containsEntry("confidence", "85")
				.containsKey("analysisJSON");
		assertThat(measurement.getStartedAt()).isEqualTo(NOW);
		assertThat(measurement.getFinishedAt()).isEqualTo(NOW);
		verifyNoInteractions(remediationService, delegateClient);
	}

	@Test
	void rejectedCanaryFailsWithZeroAndFilesOneReport() {
		givenLogs();
		modelAnswer.set("{\"text\":\"Canary throws NPE\",\"promote\":false,\"confidence\":95}");
		MetricPluginConfig config = new MetricPluginConfig();
		config.setGithubUrl("https://github.com/acme/demo");
		config.setBaseBranch("main");

		Measurement measurement = provider.run(request(config), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.FAILED);
		assertThat(measurement.getValue()).isEqualTo("0");
		assertThat(measurement.getMetadata()).containsEntry("confidence", "95");

		ArgumentCaptor<RemediationRequest> captor = ArgumentCaptor.forClass(RemediationRequest.class);
		verify(remediationService).reportCanaryFailure(captor.capture());
		assertThat(captor.getValue().repository().url()).isEqualTo("https://github.com/acme/demo");
		assertThat(captor.getValue().logContext()).contains("INFO all good too");
	}

	@Test
	void proseWrappedAnswerIsStillRead() {
		givenLogs();
		modelAnswer.set("Here is the result: {\"text\":\"ok\",\"promote\":true,\"confidence\":80} thanks");

		Measurement measurement = provider.run(request(new MetricPluginConfig()), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.SUCCESSFUL);
		assertThat(measurement.getValue()).isEqualTo("0.80");
	}

	@Test
	void delegatedModeWithoutPodNameErrorsBeforeAnyCall() {
		MetricPluginConfig config = new MetricPluginConfig();
		config.setAnalysisMode("agent");
		config.setNamespace("rollouts-demo");

		Measurement measurement = provider.run(request(config), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.ERROR);
		assertThat(measurement.getMessage()).isEqualTo("agent mode requires namespace and podName to be configured");
		assertThat(modelCalls).hasValue(0);
		verifyNoInteractions(logFetcher, delegateClient, remediationService);
	}

	@Test
	void missingCanaryPodsCountAsSuccess() {
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "role=stable")).thenReturn("INFO ok");
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "role=canary"))
				.thenThrow(new PodsNotFoundException("no pods found for selector role=canary"));

		Measurement measurement = provider.run(request(null), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.SUCCESSFUL);
		assertThat(measurement.getValue()).isEqualTo("1");
		assertThat(modelCalls).hasValue(0);
	}

	@Test
	void missingStablePodsIsAnError() {
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "role=stable"))
				.thenThrow(new PodsNotFoundException("no pods found for selector role=stable in namespace rollouts-demo"));

		Measurement measurement = provider.run(request(null), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.ERROR);
		assertThat(measurement.getMessage()).contains("role=stable");
	}

	@Test
	void customSelectorsAndModelAreUsed() {
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "app=demo,track=stable")).thenReturn("s");
		when(logFetcher.fetchFirstPodLogs("rollouts-demo", "app=demo,track=canary")).thenReturn("c");
		AtomicReference<String> usedModel = new AtomicReference<>();
		modelCaller = (model, segments, signal) -> {
			usedModel.set(model);
			return ModelResponse.ofText("{\"text\":\"ok\",\"promote\":true,\"confidence\":100}");
		};
		MetricPluginConfig config = new MetricPluginConfig();
		config.setStableLabel("app=demo,track=stable");
		config.setCanaryLabel("app=demo,track=canary");
		config.setModel("gemini-2.5-pro");

		Measurement measurement = provider.run(request(config), new CancellationSignal());

		assertThat(measurement.getValue()).isEqualTo("1.00");
		assertThat(usedModel).hasValue("gemini-2.5-pro");
	}

	@Test
	void exhaustedRateLimitBecomesErrorMeasurement() {
		givenLogs();
		modelCaller = (model, segments, signal) -> {
			modelCalls.incrementAndGet();
			throw new ModelApiException(429, ModelApiException.RESOURCE_EXHAUSTED, "quota exceeded", List.of());
		};

		Measurement measurement = provider.run(request(new MetricPluginConfig()), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.ERROR);
		assertThat(measurement.getMessage()).startsWith("max retries exceeded after 3 attempts");
		assertThat(modelCalls).hasValue(3);
	}

	@Test
	void delegatedModeResolvesTemplateHashAndUsesAgent() {
		givenLogs();
		when(podNameResolver.resolveTemplateHash("rollouts-demo", "7d9f8b6c4"))
				.thenReturn("canary-demo-7d9f8b6c4-abcde");
		when(delegateClient.getBaseUrl()).thenReturn("http://kubernetes-agent:8080");
		A2AResponse response = new A2AResponse();
		response.setAnalysis("Canary is healthy");
		response.setPromote(true);
		response.setConfidence(90);
		when(delegateClient.analyze(eq("rollouts-demo"), eq("canary-demo-7d9f8b6c4-abcde"), anyString(),
				anyString(), any())).thenReturn(response);

		MetricPluginConfig config = new MetricPluginConfig();
		config.setAnalysisMode("agent");
		config.setNamespace("rollouts-demo");
		config.setPodName("7d9f8b6c4");

		Measurement measurement = provider.run(request(config), new CancellationSignal());

		assertThat(measurement.getPhase()).isEqualTo(MeasurementPhase.SUCCESSFUL);
		assertThat(measurement.getValue()).isEqualTo("0.90");
		assertThat(modelCalls).hasValue(0);
		verify(delegateClient).healthCheck(any());
	}

	@Test
	void metadataDescribesProviderAndConfig() {
		MetricPluginConfig config = new MetricPluginConfig();
		config.setModel("gemini-2.0-flash");
		config.setStableLabel("role=stable");

		assertThat(provider.type()).isEqualTo("MetricAI");
		assertThat(provider.metadata(config))
				.containsEntry("provider", "MetricAI")
				.containsEntry("model", "gemini-2.0-flash")
				.containsEntry("stableLabel", "role=stable")
				.doesNotContainKey("canaryLabel");
		assertThat(provider.metadata(null)).containsOnlyKeys("provider");
	}
}
