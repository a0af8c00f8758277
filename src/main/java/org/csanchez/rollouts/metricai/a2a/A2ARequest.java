package org.csanchez.rollouts.metricai.a2a;

import java.util.Map;

/**
 * A2A analyze request sent to the Kubernetes agent
 */
public class A2ARequest {
	private String userId;
	private String prompt;
	private Map<String, Object> context;

	public A2ARequest() {
	}

	public A2ARequest(String userId, String prompt, Map<String, Object> context) {
		this.userId = userId;
		this.prompt = prompt;
		this.context = context;
	}

	public String getUserId() {
		return userId;
	}

	public void setUserId(String userId) {
		this.userId = userId;
	}

	public String getPrompt() {
		return prompt;
	}

	public void setPrompt(String prompt) {
		this.prompt = prompt;
	}

	public Map<String, Object> getContext() {
		return context;
	}

	public void setContext(Map<String, Object> context) {
		this.context = context;
	}
}
