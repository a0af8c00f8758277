package org.csanchez.rollouts.metricai.config;

import io.github.resilience4j.core.IntervalFunction;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Settings under {@code metricai.*}. Bound once at start-up and passed to the
 * components that need them.
 *
 * @param secretsDir     directory holding the mounted secret files
 * @param defaultModel   model used when a metric does not name one
 * @param geminiApiUrl   base URL of the Gemini REST API
 * @param httpTimeout    timeout for short calls (model API, agent health probe, GitHub)
 * @param agentUrl       base URL of the Kubernetes agent
 * @param agentTimeout   timeout for agent analyze calls
 * @param githubApiUrl   base URL of the GitHub REST API
 * @param stableLabel    default label selector for stable pods
 * @param canaryLabel    default label selector for canary pods
 * @param maxAttempts    attempts per model call while rate limited
 * @param backoff        exponential backoff between rate limited attempts
 */
@ConfigurationProperties(prefix = "metricai")
public record MetricAiProperties(
		@DefaultValue("/etc/secrets") String secretsDir,
		@DefaultValue("gemini-2.0-flash") String defaultModel,
		@DefaultValue("https://generativelanguage.googleapis.com") String geminiApiUrl,
		@DefaultValue("60s") Duration httpTimeout,
		@DefaultValue("http://kubernetes-agent.argo-rollouts.svc.cluster.local:8080") String agentUrl,
		@DefaultValue("5m") Duration agentTimeout,
		@DefaultValue("https://api.github.com") String githubApiUrl,
		@DefaultValue("role=stable") String stableLabel,
		@DefaultValue("role=canary") String canaryLabel,
		@DefaultValue("3") int maxAttempts,
		@DefaultValue Backoff backoff) {

	public record Backoff(
			@DefaultValue("1s") Duration initialInterval,
			@DefaultValue("2.0") double multiplier,
			@DefaultValue("60s") Duration maxInterval,
			@DefaultValue("0.1") double randomizationFactor) {

		/**
		 * Jittered exponential schedule; rejects a non-positive interval or a factor outside [0, 1)
		 */
		public IntervalFunction toIntervalFunction() {
			return IntervalFunction.ofExponentialRandomBackoff(initialInterval, multiplier, randomizationFactor,
					maxInterval);
		}
	}
}
