package org.csanchez.rollouts.metricai.a2a;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.csanchez.rollouts.metricai.error.AnalysisException;
import org.csanchez.rollouts.metricai.error.DelegateUnreachableException;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Talks to the Kubernetes agent's {@code /a2a/analyze} endpoint.
 */
public class A2AClient implements DelegateClient {

	private static final Logger logger = LoggerFactory.getLogger(A2AClient.class);
	private static final ObjectMapper objectMapper = new ObjectMapper();
	private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

	static final String USER_ID = "argo-rollouts";

	private final String baseUrl;
	private final OkHttpClient probeClient;
	private final OkHttpClient analyzeClient;

	/**
	 * @param httpClient      client with short default timeouts, used for the health probe
	 * @param baseUrl         agent base URL, e.g. {@code http://kubernetes-agent:8080}
	 * @param analyzeTimeout  timeout for analyze calls, which may run a multi-step investigation
	 */
	public A2AClient(OkHttpClient httpClient, String baseUrl, Duration analyzeTimeout) {
		Objects.requireNonNull(httpClient, "httpClient cannot be null");
		this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl cannot be null"));
		this.probeClient = httpClient;
		this.analyzeClient = httpClient.newBuilder()
				.readTimeout(analyzeTimeout)
				.callTimeout(analyzeTimeout)
				.build();
	}

	@Override
	public String getBaseUrl() {
		return baseUrl;
	}

	@Override
	public void healthCheck(CancellationSignal signal) {
		Request request = new Request.Builder().url(baseUrl + "/").get().build();
		Call call = probeClient.newCall(request);
		try (CancellationSignal.Registration ignored = signal.onCancel(call::cancel);
				Response response = call.execute()) {
			// a 404 only means there is no handler at "/", the agent is still up
			logger.debug("Kubernetes Agent responded to health check with status {}", response.code());
		} catch (IOException e) {
			signal.throwIfCancelled("agent health check");
			throw new DelegateUnreachableException("health check failed: " + e.getMessage(), e);
		}
	}

	@Override
	public A2AResponse analyze(String namespace, String podName, String stableLogs, String canaryLogs,
			CancellationSignal signal) {
		logger.info("Sending analysis request to Kubernetes Agent for {}/{}", namespace, podName);

		String body;
		try {
			body = objectMapper.writeValueAsString(buildRequest(namespace, podName, stableLogs, canaryLogs));
		} catch (JsonProcessingException e) {
			throw new AnalysisException("failed to marshal request: " + e.getMessage(), e);
		}

		Request request = new Request.Builder()
				.url(baseUrl + "/a2a/analyze")
				.post(RequestBody.create(body, JSON))
				.build();

		Call call = analyzeClient.newCall(request);
		try (CancellationSignal.Registration ignored = signal.onCancel(call::cancel);
				Response response = call.execute()) {
			if (!response.isSuccessful()) {
				throw new AnalysisException("agent returned status " + response.code());
			}
			ResponseBody responseBody = response.body();
			A2AResponse result;
			try {
				result = objectMapper.readValue(responseBody != null ? responseBody.string() : "", A2AResponse.class);
			} catch (JsonProcessingException e) {
				throw new AnalysisException("failed to decode response: " + e.getOriginalMessage(), e);
			}
			if (result == null) {
				throw new AnalysisException("failed to decode response: empty body");
			}

			logger.info("Received analysis from Kubernetes Agent: promote={}, confidence={}, hasPR={}",
					result.isPromote(), result.getConfidence(), result.hasPrLink());
			return result;
		} catch (IOException e) {
			signal.throwIfCancelled("agent analysis");
			throw new DelegateUnreachableException("failed to send request: " + e.getMessage(), e);
		}
	}

	static A2ARequest buildRequest(String namespace, String podName, String stableLogs, String canaryLogs) {
		Map<String, Object> context = new LinkedHashMap<>();
		context.put("namespace", namespace);
		context.put("podName", podName);
		context.put("stableLogs", stableLogs);
		context.put("canaryLogs", canaryLogs);

		String prompt = String.format(
				"Analyze canary deployment issue. Namespace: %s, Pod: %s. "
						+ "Compare stable vs canary behavior and determine if canary should be promoted.",
				namespace, podName);
		return new A2ARequest(USER_ID, prompt, context);
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}
}
