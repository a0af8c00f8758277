package org.csanchez.rollouts.metricai.verdict;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Outcome reported to the caller: promote with a score in [0, 1], fail with
 * score 0, or error with a message.
 */
public final class Verdict {

	public enum Kind {
		PROMOTE, FAIL, ERROR
	}

	private final Kind kind;
	private final String score;
	private final String message;
	private final Map<String, String> metadata;

	private Verdict(Kind kind, String score, String message, Map<String, String> metadata) {
		this.kind = kind;
		this.score = score;
		this.message = message;
		this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	/**
	 * Score is {@code confidence / 100} with two decimals, e.g. 85 gives "0.85"
	 */
	public static Verdict promote(int confidence, Map<String, String> metadata) {
		return new Verdict(Kind.PROMOTE, formatScore(confidence), "", metadata);
	}

	public static Verdict fail(Map<String, String> metadata) {
		return new Verdict(Kind.FAIL, "0", "", metadata);
	}

	public static Verdict error(String message) {
		return new Verdict(Kind.ERROR, "", message == null ? "" : message, Map.of());
	}

	static String formatScore(int confidence) {
		return String.format(Locale.ROOT, "%.2f", confidence / 100.0);
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Caller visible value: "0.00" to "1.00" when promoting, "0" when failing, empty on error
	 */
	public String getScore() {
		return score;
	}

	public String getMessage() {
		return message;
	}

	public Map<String, String> getMetadata() {
		return metadata;
	}

	@Override
	public String toString() {
		return "Verdict{kind=" + kind + ", score='" + score + "', message='" + message + "'}";
	}
}
