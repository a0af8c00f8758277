package org.csanchez.rollouts.metricai.config;

/**
 * Secrets read at start-up. {@code googleCloudProject} may be empty.
 */
public record Credentials(String googleApiKey, String googleCloudProject, String githubToken) {

	@Override
	public String toString() {
		return "Credentials{googleCloudProject='" + googleCloudProject + "'}";
	}
}
