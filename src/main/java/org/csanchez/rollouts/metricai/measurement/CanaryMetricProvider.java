package org.csanchez.rollouts.metricai.measurement;

import org.csanchez.rollouts.metricai.analysis.AnalysisInput;
import org.csanchez.rollouts.metricai.analysis.AnalysisMode;
import org.csanchez.rollouts.metricai.analysis.AnalysisOutcome;
import org.csanchez.rollouts.metricai.analysis.ModeDispatcher;
import org.csanchez.rollouts.metricai.analysis.RepositoryCoordinates;
import org.csanchez.rollouts.metricai.k8s.LogFetcher;
import org.csanchez.rollouts.metricai.k8s.PodNameResolver;
import org.csanchez.rollouts.metricai.k8s.PodsNotFoundException;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.csanchez.rollouts.metricai.verdict.DecisionResolver;
import org.csanchez.rollouts.metricai.verdict.Verdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code MetricAI} metric provider: collects stable and canary logs, runs
 * the analysis in the configured mode and reports the verdict as a measurement.
 */
public class CanaryMetricProvider {

	private static final Logger logger = LoggerFactory.getLogger(CanaryMetricProvider.class);

	public static final String PROVIDER_TYPE = "MetricAI";

	private final LogFetcher logFetcher;
	private final PodNameResolver podNameResolver;
	private final ModeDispatcher dispatcher;
	private final DecisionResolver resolver;
	private final Defaults defaults;
	private final Clock clock;

	public CanaryMetricProvider(LogFetcher logFetcher, PodNameResolver podNameResolver, ModeDispatcher dispatcher,
			DecisionResolver resolver, Defaults defaults, Clock clock) {
		this.logFetcher = logFetcher;
		this.podNameResolver = podNameResolver;
		this.dispatcher = dispatcher;
		this.resolver = resolver;
		this.defaults = defaults;
		this.clock = clock;
	}

	public String type() {
		return PROVIDER_TYPE;
	}

	/**
	 * Runs one measurement. Never throws: every failure becomes an Error measurement.
	 */
	public Measurement run(MetricRunRequest request, CancellationSignal signal) {
		Measurement measurement = new Measurement();
		measurement.setStartedAt(clock.instant());

		logger.info("Running AI metric analysis: analysisRun={}, namespace={}, metric={}",
				request.getAnalysisRunName(), request.getNamespace(), request.getMetricName());

		MetricPluginConfig cfg = request.getConfig() != null ? request.getConfig() : new MetricPluginConfig();
		String stableSelector = orDefault(cfg.getStableLabel(), defaults.stableLabel());
		String canarySelector = orDefault(cfg.getCanaryLabel(), defaults.canaryLabel());
		String modelName = orDefault(cfg.getModel(), defaults.model());
		AnalysisMode mode = AnalysisMode.fromConfigValue(cfg.getAnalysisMode());

		try {
			// checked before any cluster or network call
			if (mode == AnalysisMode.DELEGATED) {
				ModeDispatcher.requireDelegatedInputs(cfg.getNamespace(), cfg.getPodName());
			}

			logger.info("Fetching pod logs for analysis: stableSelector={}, canarySelector={}, model={}",
					stableSelector, canarySelector, modelName);
			String ns = request.getNamespace();
			String stableLogs = logFetcher.fetchFirstPodLogs(ns, stableSelector);

			String canaryLogs;
			try {
				canaryLogs = logFetcher.fetchFirstPodLogs(ns, canarySelector);
			} catch (PodsNotFoundException e) {
				logger.warn("Canary pods not found, marking as successful: {}", e.getMessage());
				measurement.setValue("1");
				measurement.setPhase(MeasurementPhase.SUCCESSFUL);
				return finish(measurement);
			}
			logger.info("Successfully fetched pod logs: stableLogsLength={}, canaryLogsLength={}",
					stableLogs.length(), canaryLogs.length());

			AnalysisInput input = AnalysisInput.builder()
					.modelIdentifier(modelName)
					.logs(stableLogs, canaryLogs)
					.extraGuidance(cfg.getExtraPrompt())
					.namespace(cfg.getNamespace())
					.targetIdentifier(cfg.getPodName())
					.repository(new RepositoryCoordinates(cfg.getGithubUrl(), cfg.getBaseBranch()))
					.build();

			if (mode == AnalysisMode.DELEGATED && PodNameResolver.looksLikeTemplateHash(input.getTargetIdentifier())) {
				input = input.withTargetIdentifier(
						podNameResolver.resolveTemplateHash(input.getNamespace(), input.getTargetIdentifier()));
			}

			logger.info("Starting AI analysis: model={}, mode={}", modelName, mode.getConfigValue());
			AnalysisOutcome outcome = dispatcher.dispatch(mode, input, signal);
			logger.info("AI analysis completed: promote={}, confidence={}, analysisLength={}",
					outcome.decision().isPromote(), outcome.decision().getConfidence(),
					outcome.decision().getNarrative().length());

			Verdict verdict = resolver.resolveAndReport(input, outcome.decision());
			measurement.getMetadata().putAll(verdict.getMetadata());
			measurement.getMetadata().put("analysisJSON", outcome.rawText());
			measurement.setValue(verdict.getScore());
			measurement.setPhase(verdict.getKind() == Verdict.Kind.PROMOTE
					? MeasurementPhase.SUCCESSFUL
					: MeasurementPhase.FAILED);
			return finish(measurement);
		} catch (RuntimeException e) {
			logger.error("AI analysis failed: {}", e.getMessage());
			return markError(measurement, Verdict.error(e.getMessage()));
		}
	}

	/**
	 * Provider and configuration details shown alongside measurements
	 */
	public Map<String, String> metadata(MetricPluginConfig cfg) {
		Map<String, String> metadata = new LinkedHashMap<>();
		metadata.put("provider", PROVIDER_TYPE);
		if (cfg != null) {
			putIfSet(metadata, "model", cfg.getModel());
			putIfSet(metadata, "stableLabel", cfg.getStableLabel());
			putIfSet(metadata, "canaryLabel", cfg.getCanaryLabel());
		}
		return metadata;
	}

	private Measurement markError(Measurement measurement, Verdict verdict) {
		measurement.setPhase(MeasurementPhase.ERROR);
		measurement.setMessage(verdict.getMessage());
		return finish(measurement);
	}

	private Measurement finish(Measurement measurement) {
		measurement.setFinishedAt(clock.instant());
		return measurement;
	}

	private static String orDefault(String value, String fallback) {
		return value == null || value.isEmpty() ? fallback : value;
	}

	private static void putIfSet(Map<String, String> metadata, String key, String value) {
		if (value != null && !value.isEmpty()) {
			metadata.put(key, value);
		}
	}

	/**
	 * Values used when the metric configuration leaves them out
	 */
	public record Defaults(String model, String stableLabel, String canaryLabel) {
	}
}
