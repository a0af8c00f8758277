package org.csanchez.rollouts.metricai.analysis;

/**
 * Pulls a brace-delimited object out of free text, e.g. a model answer wrapped in prose.
 */
public final class ResponseExtractor {

	private ResponseExtractor() {
	}

	/**
	 * Returns the first top-level {@code {...}} block of {@code text} by counting
	 * braces from the first opening brace. Braces inside string literals are
	 * counted too. Returns an empty string when there is no opening brace or it
	 * is never closed.
	 */
	public static String extractFirstObject(String text) {
		if (text == null) {
			return "";
		}
		int start = text.indexOf('{');
		if (start == -1) {
			return "";
		}
		int depth = 0;
		for (int i = start; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
				if (depth == 0) {
					return text.substring(start, i + 1);
				}
			}
		}
		return "";
	}
}
