package org.csanchez.rollouts.metricai.remediation;

import org.csanchez.rollouts.metricai.analysis.RepositoryCoordinates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Opens a GitHub issue describing a canary that failed analysis.
 */
public class GitHubIssueRemediation implements RemediationService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubIssueRemediation.class);

	// https://github.com/owner/repo(.git) or git@github.com:owner/repo(.git)
	private static final Pattern REPOSITORY_URL = Pattern.compile(
			"^(?:https?://[^/]+/|git@[^:]+:)([^/]+)/([^/]+?)(?:\\.git)?/?$");

	static final int MAX_LOG_CHARS = 4000;
	static final String LABEL = "canary-failure";

	private final GitHubRestClient gitHubClient;

	public GitHubIssueRemediation(GitHubRestClient gitHubClient) {
		this.gitHubClient = gitHubClient;
	}

	@Override
	public void reportCanaryFailure(RemediationRequest request) {
		RepositoryCoordinates repository = request.repository();
		if (repository == null || !repository.isConfigured()) {
			logger.info("No GitHub repository configured, skipping issue creation");
			return;
		}

		RepositoryRef ref = parseRepository(repository.url());
		GitHubRestClient.GitHubIssue issue = gitHubClient.createIssue(ref.owner(), ref.repo(),
				new GitHubRestClient.CreateIssueRequest(
						"Canary analysis failed (" + request.modelIdentifier() + ")",
						buildBody(request),
						List.of(LABEL)));

		logger.info("Created GitHub issue #{} at {}", issue.number(), issue.htmlUrl());
	}

	static RepositoryRef parseRepository(String url) {
		Matcher matcher = REPOSITORY_URL.matcher(url.trim());
		if (!matcher.matches()) {
			throw new RemediationException("not a GitHub repository URL: " + url);
		}
		return new RepositoryRef(matcher.group(1), matcher.group(2));
	}

	static String buildBody(RemediationRequest request) {
		StringBuilder body = new StringBuilder();
		body.append("## Canary analysis\n\n");
		body.append("The canary was not promoted by the AI analysis");
		if (request.modelIdentifier() != null && !request.modelIdentifier().isEmpty()) {
			body.append(" (model `").append(request.modelIdentifier()).append("`)");
		}
		body.append(".\n\n");

		String baseBranch = request.repository().baseBranch();
		if (baseBranch != null && !baseBranch.isEmpty()) {
			body.append("Base branch: `").append(baseBranch).append("`\n\n");
		}

		body.append("### Analysis\n\n").append(request.analysis()).append("\n\n");
		body.append("### Logs\n\n```\n").append(truncate(request.logContext(), MAX_LOG_CHARS)).append("\n```\n");
		return body.toString();
	}

	static String truncate(String text, int maxChars) {
		if (text == null) {
			return "";
		}
		if (text.length() <= maxChars) {
			return text;
		}
		return text.substring(0, maxChars) + "...";
	}

	record RepositoryRef(String owner, String repo) {
	}
}
