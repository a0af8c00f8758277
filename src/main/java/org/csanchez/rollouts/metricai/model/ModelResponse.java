package org.csanchez.rollouts.metricai.model;

import java.util.List;

/**
 * Candidates returned by one model call, each an ordered list of text fragments.
 */
public class ModelResponse {

	private final List<List<String>> candidates;

	public ModelResponse(List<List<String>> candidates) {
		this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
	}

	public static ModelResponse ofText(String text) {
		return new ModelResponse(List.of(List.of(text)));
	}

	public List<List<String>> getCandidates() {
		return candidates;
	}

	/**
	 * All fragments of all candidates, in order, with no separator
	 */
	public String concatenatedText() {
		StringBuilder sb = new StringBuilder();
		for (List<String> fragments : candidates) {
			for (String fragment : fragments) {
				if (fragment != null && !fragment.isEmpty()) {
					sb.append(fragment);
				}
			}
		}
		return sb.toString();
	}
}
