package org.csanchez.rollouts.metricai.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.genai.types.Candidate;
import com.google.genai.types.Content;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.Part;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ModelCaller} for the Gemini {@code generateContent} REST endpoint.
 *
 * <p>The REST endpoint is called directly rather than through the SDK client so
 * that the structured {@code details} of error payloads (retry hints, quota
 * violations) reach the retry logic. Request and response bodies still use the
 * Gen AI SDK types.
 */
public class GeminiModelCaller implements ModelCaller {

	private static final Logger logger = LoggerFactory.getLogger(GeminiModelCaller.class);
	private static final ObjectMapper objectMapper = new ObjectMapper();
	private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
	private static final TypeReference<List<Map<String, Object>>> DETAILS_TYPE = new TypeReference<>() {
	};

	private final OkHttpClient httpClient;
	private final String apiBaseUrl;
	private final String apiKey;

	/**
	 * @param httpClient shared client; its default (short) timeouts apply to every call
	 * @param apiBaseUrl e.g. {@code https://generativelanguage.googleapis.com}
	 * @param apiKey     Gemini API key
	 */
	public GeminiModelCaller(OkHttpClient httpClient, String apiBaseUrl, String apiKey) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
		this.apiBaseUrl = stripTrailingSlash(Objects.requireNonNull(apiBaseUrl, "apiBaseUrl cannot be null"));
		this.apiKey = Objects.requireNonNull(apiKey, "apiKey cannot be null");
	}

	@Override
	public ModelResponse generate(String modelIdentifier, List<String> segments, CancellationSignal signal) {
		MDC.put("model", modelIdentifier);
		try {
			Request request = new Request.Builder()
					.url(apiBaseUrl + "/v1beta/" + modelPath(modelIdentifier) + ":generateContent")
					.header("x-goog-api-key", apiKey)
					.post(RequestBody.create(buildRequestBody(segments), JSON))
					.build();

			Call call = httpClient.newCall(request);
			try (CancellationSignal.Registration ignored = signal.onCancel(call::cancel);
					Response response = call.execute()) {
				ResponseBody body = response.body();
				String responseBody = body != null ? body.string() : "";

				if (!response.isSuccessful()) {
					throw toApiException(response.code(), responseBody);
				}

				logger.debug("Received response from Gemini: {}", responseBody);
				return toModelResponse(GenerateContentResponse.fromJson(responseBody));
			} catch (IOException e) {
				signal.throwIfCancelled("model call");
				throw new ModelApiException(0, "UNAVAILABLE", "failed to send request: " + e.getMessage(),
						List.of(), e);
			}
		} finally {
			MDC.remove("model");
		}
	}

	private String buildRequestBody(List<String> segments) {
		Part[] parts = segments.stream()
				.map(Part::fromText)
				.toArray(Part[]::new);
		Content content = Content.fromParts(parts);
		try {
			ObjectNode requestBody = objectMapper.createObjectNode();
			ArrayNode contents = requestBody.putArray("contents");
			ObjectNode userTurn = (ObjectNode) objectMapper.readTree(content.toJson());
			userTurn.put("role", "user");
			contents.add(userTurn);
			return requestBody.toString();
		} catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to serialize request content", e);
		}
	}

	/**
	 * Resource name of the model. Bare names get the {@code models/} prefix; names
	 * already qualified as {@code models/...} or {@code tunedModels/...} are kept.
	 */
	static String modelPath(String modelIdentifier) {
		if (modelIdentifier.startsWith("models/") || modelIdentifier.startsWith("tunedModels/")) {
			return modelIdentifier;
		}
		return "models/" + modelIdentifier;
	}

	static ModelResponse toModelResponse(GenerateContentResponse response) {
		List<List<String>> candidates = new ArrayList<>();
		if (response == null) {
			return new ModelResponse(candidates);
		}
		for (Candidate candidate : response.candidates().orElse(List.of())) {
			List<String> fragments = new ArrayList<>();
			candidate.content()
					.flatMap(Content::parts)
					.orElse(List.of())
					.forEach(part -> part.text().ifPresent(fragments::add));
			candidates.add(fragments);
		}
		return new ModelResponse(candidates);
	}

	/**
	 * Maps an error payload {@code {"error":{code,message,status,details}}} to an exception.
	 * Bodies that are not in that shape keep the HTTP status code and raw text.
	 */
	static ModelApiException toApiException(int httpCode, String responseBody) {
		try {
			JsonNode error = objectMapper.readTree(responseBody).path("error");
			if (error.isObject()) {
				int code = error.path("code").asInt(httpCode);
				String status = error.path("status").asText("");
				String message = error.path("message").asText(responseBody);
				List<Map<String, Object>> details = error.has("details")
						? objectMapper.convertValue(error.get("details"), DETAILS_TYPE)
						: List.of();
				return new ModelApiException(code, status, message, details);
			}
		} catch (JsonProcessingException | IllegalArgumentException e) {
			logger.debug("Error body is not a structured API error: {}", e.getMessage());
		}
		return new ModelApiException(httpCode, "", "model API returned status " + httpCode + ": " + responseBody,
				List.of());
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}
}
