package org.csanchez.rollouts.metricai.measurement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-metric settings from the AnalysisTemplate's {@code argoproj-labs/metric-ai} plugin block.
 * Every field is optional.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class MetricPluginConfig {
	private String model;
	private String stableLabel;
	private String canaryLabel;
	private String baseBranch;
	private String githubUrl;
	// "default" or "agent"
	private String analysisMode;
	private String namespace;
	private String podName;
	private String extraPrompt;

	public String getModel() {
		return model;
	}

	public void setModel(String model) {
		this.model = model;
	}

	public String getStableLabel() {
		return stableLabel;
	}

	public void setStableLabel(String stableLabel) {
		this.stableLabel = stableLabel;
	}

	public String getCanaryLabel() {
		return canaryLabel;
	}

	public void setCanaryLabel(String canaryLabel) {
		this.canaryLabel = canaryLabel;
	}

	public String getBaseBranch() {
		return baseBranch;
	}

	public void setBaseBranch(String baseBranch) {
		this.baseBranch = baseBranch;
	}

	public String getGithubUrl() {
		return githubUrl;
	}

	public void setGithubUrl(String githubUrl) {
		this.githubUrl = githubUrl;
	}

	public String getAnalysisMode() {
		return analysisMode;
	}

	public void setAnalysisMode(String analysisMode) {
		this.analysisMode = analysisMode;
	}

	public String getNamespace() {
		return namespace;
	}

	public void setNamespace(String namespace) {
		this.namespace = namespace;
	}

	public String getPodName() {
		return podName;
	}

	public void setPodName(String podName) {
		this.podName = podName;
	}

	public String getExtraPrompt() {
		return extraPrompt;
	}

	public void setExtraPrompt(String extraPrompt) {
		this.extraPrompt = extraPrompt;
	}
}
