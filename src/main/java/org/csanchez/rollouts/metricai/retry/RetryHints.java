package org.csanchez.rollouts.metricai.retry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the structured detail entries attached to a rate-limit error.
 * Only two {@code @type} discriminators are recognised; everything else is ignored.
 */
public final class RetryHints {

	public static final String TYPE_RETRY_INFO = "type.googleapis.com/google.rpc.RetryInfo";
	public static final String TYPE_QUOTA_FAILURE = "type.googleapis.com/google.rpc.QuotaFailure";

	// e.g. "30s", "1.5s"
	private static final Pattern SECONDS = Pattern.compile("^(\\d+(?:\\.\\d+)?)s$");

	private RetryHints() {
	}

	/**
	 * Server suggested wait from the first parseable RetryInfo entry
	 */
	public static Optional<Duration> retryDelay(List<Map<String, Object>> details) {
		for (Map<String, Object> detail : details) {
			if (TYPE_RETRY_INFO.equals(detail.get("@type")) && detail.get("retryDelay") instanceof String) {
				Optional<Duration> parsed = parseDelay((String) detail.get("retryDelay"));
				if (parsed.isPresent()) {
					return parsed;
				}
			}
		}
		return Optional.empty();
	}

	/**
	 * Parses a delay in seconds, the only format the API emits. Zero or
	 * malformed values yield empty.
	 */
	public static Optional<Duration> parseDelay(String text) {
		if (text == null) {
			return Optional.empty();
		}
		Matcher matcher = SECONDS.matcher(text.trim());
		if (!matcher.matches()) {
			return Optional.empty();
		}
		long millis = Math.round(Double.parseDouble(matcher.group(1)) * 1000);
		return millis > 0 ? Optional.of(Duration.ofMillis(millis)) : Optional.empty();
	}

	/**
	 * Violations listed in QuotaFailure entries. Used for logging only.
	 */
	public static List<QuotaViolation> quotaViolations(List<Map<String, Object>> details) {
		List<QuotaViolation> violations = new ArrayList<>();
		for (Map<String, Object> detail : details) {
			if (!TYPE_QUOTA_FAILURE.equals(detail.get("@type")) || !(detail.get("violations") instanceof List)) {
				continue;
			}
			for (Object entry : (List<?>) detail.get("violations")) {
				if (entry instanceof Map) {
					Map<?, ?> violation = (Map<?, ?>) entry;
					violations.add(new QuotaViolation(
							asString(violation.get("quotaMetric")),
							asString(violation.get("quotaId")),
							asString(violation.get("quotaValue")),
							dimensions(violation.get("quotaDimensions"))));
				}
			}
		}
		return violations;
	}

	private static Map<String, String> dimensions(Object value) {
		Map<String, String> dimensions = new LinkedHashMap<>();
		if (value instanceof Map) {
			((Map<?, ?>) value).forEach((k, v) -> dimensions.put(asString(k), asString(v)));
		}
		return dimensions;
	}

	private static String asString(Object value) {
		return value == null ? "" : value.toString();
	}

	public record QuotaViolation(String quotaMetric, String quotaId, String quotaValue,
			Map<String, String> quotaDimensions) {
	}
}
