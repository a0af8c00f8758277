package org.csanchez.rollouts.metricai.analysis;

/**
 * Source repository that failure reports are filed against.
 *
 * @param url        repository URL, e.g. {@code https://github.com/owner/repo}
 * @param baseBranch branch the canary was built from, may be empty
 */
public record RepositoryCoordinates(String url, String baseBranch) {

	public static RepositoryCoordinates none() {
		return new RepositoryCoordinates("", "");
	}

	public boolean isConfigured() {
		return url != null && !url.isBlank();
	}
}
