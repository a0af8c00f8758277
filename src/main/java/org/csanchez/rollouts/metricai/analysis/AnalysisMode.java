package org.csanchez.rollouts.metricai.analysis;

/**
 * How a canary is analysed. Configured as {@code analysisMode} in the metric
 * provider settings.
 */
public enum AnalysisMode {

	/** Prompt a generative model directly with the collected logs */
	DIRECT("default"),

	/** Hand the analysis to the remote Kubernetes agent over A2A */
	DELEGATED("agent");

	private final String configValue;

	AnalysisMode(String configValue) {
		this.configValue = configValue;
	}

	public String getConfigValue() {
		return configValue;
	}

	/**
	 * Only the exact value {@code agent} selects {@link #DELEGATED}; anything else,
	 * including other spellings or an empty value, selects {@link #DIRECT}
	 */
	public static AnalysisMode fromConfigValue(String value) {
		if (DELEGATED.configValue.equals(value)) {
			return DELEGATED;
		}
		return DIRECT;
	}
}
