package org.csanchez.rollouts.metricai.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads credentials from files mounted out of the {@code argo-rollouts} secret.
 */
public final class SecretFileLoader {

	private static final Logger logger = LoggerFactory.getLogger(SecretFileLoader.class);

	static final String GOOGLE_API_KEY = "google_api_key";
	static final String GOOGLE_CLOUD_PROJECT = "google_cloud_project";
	static final String GITHUB_TOKEN = "github_token";

	private SecretFileLoader() {
	}

	/**
	 * @throws IllegalStateException when a required secret is missing or empty
	 */
	public static Credentials load(Path secretsDir) {
		String apiKey = readRequired(secretsDir.resolve(GOOGLE_API_KEY), "Google API key");

		String project = "";
		Path projectFile = secretsDir.resolve(GOOGLE_CLOUD_PROJECT);
		try {
			project = read(projectFile);
		} catch (IOException e) {
			logger.warn("Google Cloud Project not found in {}: {}", projectFile, e.getMessage());
		}

		String githubToken = readRequired(secretsDir.resolve(GITHUB_TOKEN), "GitHub token");

		logger.info("Successfully loaded configuration from mounted files in {}", secretsDir);
		return new Credentials(apiKey, project, githubToken);
	}

	private static String readRequired(Path file, String what) {
		String value;
		try {
			value = read(file);
		} catch (IOException e) {
			throw new IllegalStateException("failed to read " + what + " from " + file + ": " + e.getMessage(), e);
		}
		if (value.isEmpty()) {
			throw new IllegalStateException(what + " is empty in " + file);
		}
		return value;
	}

	private static String read(Path file) throws IOException {
		return Files.readString(file, StandardCharsets.UTF_8).trim();
	}
}
