package org.csanchez.rollouts.metricai.analysis;

import java.util.Objects;

/**
 * Everything one analysis needs. Immutable; build with {@link #builder()}.
 */
public final class AnalysisInput {

	public static final String STABLE_MARKER = "--- STABLE LOGS ---";
	public static final String CANARY_MARKER = "--- CANARY LOGS ---";

	private final String modelIdentifier;
	private final String logContext;
	private final String extraGuidance;
	private final String namespace;
	private final String targetIdentifier;
	private final RepositoryCoordinates repository;

	private AnalysisInput(Builder builder) {
		this.modelIdentifier = Objects.requireNonNull(builder.modelIdentifier, "modelIdentifier cannot be null");
		this.logContext = Objects.requireNonNull(builder.logContext, "logContext cannot be null");
		this.extraGuidance = nullToEmpty(builder.extraGuidance);
		this.namespace = nullToEmpty(builder.namespace);
		this.targetIdentifier = nullToEmpty(builder.targetIdentifier);
		this.repository = builder.repository != null ? builder.repository : RepositoryCoordinates.none();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Joins both log segments behind their markers, stable first
	 */
	public static String combineLogs(String stableLogs, String canaryLogs) {
		return STABLE_MARKER + "\n" + nullToEmpty(stableLogs) + "\n\n" + CANARY_MARKER + "\n" + nullToEmpty(canaryLogs);
	}

	public String getModelIdentifier() {
		return modelIdentifier;
	}

	public String getLogContext() {
		return logContext;
	}

	public String getExtraGuidance() {
		return extraGuidance;
	}

	public String getNamespace() {
		return namespace;
	}

	public String getTargetIdentifier() {
		return targetIdentifier;
	}

	public RepositoryCoordinates getRepository() {
		return repository;
	}

	/**
	 * Copy with a different target, used once a pod template hash is resolved to a pod name
	 */
	public AnalysisInput withTargetIdentifier(String targetIdentifier) {
		return builder()
				.modelIdentifier(modelIdentifier)
				.logContext(logContext)
				.extraGuidance(extraGuidance)
				.namespace(namespace)
				.targetIdentifier(targetIdentifier)
				.repository(repository)
				.build();
	}

	private static String nullToEmpty(String value) {
		return value == null ? "" : value;
	}

	public static class Builder {
		private String modelIdentifier;
		private String logContext;
		private String extraGuidance;
		private String namespace;
		private String targetIdentifier;
		private RepositoryCoordinates repository;

		public Builder modelIdentifier(String modelIdentifier) {
			this.modelIdentifier = modelIdentifier;
			return this;
		}

		public Builder logContext(String logContext) {
			this.logContext = logContext;
			return this;
		}

		public Builder logs(String stableLogs, String canaryLogs) {
			this.logContext = combineLogs(stableLogs, canaryLogs);
			return this;
		}

		public Builder extraGuidance(String extraGuidance) {
			this.extraGuidance = extraGuidance;
			return this;
		}

		public Builder namespace(String namespace) {
			this.namespace = namespace;
			return this;
		}

		public Builder targetIdentifier(String targetIdentifier) {
			this.targetIdentifier = targetIdentifier;
			return this;
		}

		public Builder repository(RepositoryCoordinates repository) {
			this.repository = repository;
			return this;
		}

		public AnalysisInput build() {
			return new AnalysisInput(this);
		}
	}
}
