package org.csanchez.rollouts.metricai.measurement;

/**
 * A measurement request for one metric of an AnalysisRun
 */
public class MetricRunRequest {
	private String analysisRunName;
	// namespace of the AnalysisRun, where the stable and canary pods live
	private String namespace;
	private String metricName;
	private MetricPluginConfig config;

	public MetricRunRequest() {
	}

	public MetricRunRequest(String analysisRunName, String namespace, String metricName, MetricPluginConfig config) {
		this.analysisRunName = analysisRunName;
		this.namespace = namespace;
		this.metricName = metricName;
		this.config = config;
	}

	public String getAnalysisRunName() {
		return analysisRunName;
	}

	public void setAnalysisRunName(String analysisRunName) {
		this.analysisRunName = analysisRunName;
	}

	public String getNamespace() {
		return namespace;
	}

	public void setNamespace(String namespace) {
		this.namespace = namespace;
	}

	public String getMetricName() {
		return metricName;
	}

	public void setMetricName(String metricName) {
		this.metricName = metricName;
	}

	public MetricPluginConfig getConfig() {
		return config;
	}

	public void setConfig(MetricPluginConfig config) {
		this.config = config;
	}
}
