package org.csanchez.rollouts.metricai.model;

import org.csanchez.rollouts.metricai.retry.CancellationSignal;

import java.util.List;

/**
 * Performs exactly one generate call against a generative model.
 */
public interface ModelCaller {

	/**
	 * @param modelIdentifier model to invoke, e.g. {@code gemini-2.0-flash}
	 * @param segments        ordered text segments sent as a single user turn
	 * @throws ModelApiException when the API answers with an error or cannot be reached
	 */
	ModelResponse generate(String modelIdentifier, List<String> segments, CancellationSignal signal);
}
