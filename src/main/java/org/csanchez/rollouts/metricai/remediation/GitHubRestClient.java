package org.csanchez.rollouts.metricai.remediation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Minimal GitHub REST client for the issues API
 */
public class GitHubRestClient {

	private static final ObjectMapper objectMapper = new ObjectMapper();
	private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

	private final OkHttpClient httpClient;
	private final String apiBaseUrl;
	private final String token;

	public GitHubRestClient(OkHttpClient httpClient, String apiBaseUrl, String token) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
		this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
		this.token = Objects.requireNonNull(token, "token cannot be null");
	}

	/**
	 * POST /repos/{owner}/{repo}/issues
	 */
	public GitHubIssue createIssue(String owner, String repo, CreateIssueRequest issue) {
		String body;
		try {
			body = objectMapper.writeValueAsString(issue);
		} catch (JsonProcessingException e) {
			throw new RemediationException("failed to marshal issue: " + e.getOriginalMessage(), e);
		}

		Request request = new Request.Builder()
				.url(apiBaseUrl + "/repos/" + owner + "/" + repo + "/issues")
				.header("Authorization", "Bearer " + token)
				.header("Accept", "application/vnd.github+json")
				.post(RequestBody.create(body, JSON))
				.build();

		try (Response response = httpClient.newCall(request).execute()) {
			ResponseBody responseBody = response.body();
			String text = responseBody != null ? responseBody.string() : "";
			if (!response.isSuccessful()) {
				throw new RemediationException("GitHub returned status " + response.code() + ": " + text);
			}
			return objectMapper.readValue(text, GitHubIssue.class);
		} catch (IOException e) {
			throw new RemediationException("failed to create GitHub issue: " + e.getMessage(), e);
		}
	}

	// DTOs
	public record CreateIssueRequest(
			String title,
			String body,
			List<String> labels
	) {}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record GitHubIssue(
			int number,
			@JsonProperty("html_url") String htmlUrl,
			String state,
			String title
	) {}
}
