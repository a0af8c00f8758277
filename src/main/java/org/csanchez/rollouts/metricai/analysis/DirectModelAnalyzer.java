package org.csanchez.rollouts.metricai.analysis;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.csanchez.rollouts.metricai.model.ModelCaller;
import org.csanchez.rollouts.metricai.model.ModelResponse;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.csanchez.rollouts.metricai.retry.RetryController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Asks a generative model for a promote/abort decision on the raw logs.
 */
public class DirectModelAnalyzer implements CanaryAnalyzer {

	private static final Logger logger = LoggerFactory.getLogger(DirectModelAnalyzer.class);
	private static final ObjectMapper objectMapper = new ObjectMapper()
			.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
			.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);

	static final String INSTRUCTIONS = """
			Analyze the behavior of this canary deployment from its logs, comparing the stable version against the canary version. \
			Reply with a single JSON object and nothing else, with exactly these entries: \
			'text' (string) with your analysis; \
			'promote' (boolean) true to promote the canary or false to abort it; \
			'confidence' (integer from 0 to 100) with your confidence in that decision. \
			The stable version logs start with '%s' and the canary version logs start with '%s'. \
			If there is not enough information to make a determination, default to promote: true.""".formatted(
			AnalysisInput.STABLE_MARKER, AnalysisInput.CANARY_MARKER);

	private final ModelCaller modelCaller;
	private final RetryController retryController;
	private final int maxAttempts;

	public DirectModelAnalyzer(ModelCaller modelCaller, RetryController retryController, int maxAttempts) {
		this.modelCaller = modelCaller;
		this.retryController = retryController;
		this.maxAttempts = maxAttempts;
	}

	/**
	 * Calls the model and reads its decision. Output that cannot be read as a
	 * decision, even after extracting the first JSON object, yields
	 * {@link DecisionRecord#empty()} together with the model text and no error.
	 */
	@Override
	public AnalysisOutcome analyze(AnalysisInput input, CancellationSignal signal) {
		List<String> segments = List.of(buildInstructions(input.getExtraGuidance()) + "\n\n" + input.getLogContext());

		logger.info("Sending analysis request to model {}", input.getModelIdentifier());
		ModelResponse response = retryController.execute(
				() -> modelCaller.generate(input.getModelIdentifier(), segments, signal),
				maxAttempts, signal);

		String rawText = response.concatenatedText().trim();

		Optional<DecisionRecord> decision = parseDecision(rawText);
		if (decision.isPresent()) {
			return new AnalysisOutcome(rawText, decision.get());
		}

		// model might have wrapped the JSON in prose
		String extracted = ResponseExtractor.extractFirstObject(rawText);
		if (!extracted.isEmpty()) {
			decision = parseDecision(extracted);
			if (decision.isPresent()) {
				logger.debug("Recovered decision from surrounding text");
				return new AnalysisOutcome(extracted, decision.get());
			}
		}

		logger.warn("Model output could not be parsed into a decision, returning an empty decision");
		return new AnalysisOutcome(rawText, DecisionRecord.empty());
	}

	static String buildInstructions(String extraGuidance) {
		if (extraGuidance == null || extraGuidance.isEmpty()) {
			return INSTRUCTIONS;
		}
		return INSTRUCTIONS + "\n\nAdditional context: " + extraGuidance;
	}

	static Optional<DecisionRecord> parseDecision(String text) {
		if (text.isEmpty()) {
			return Optional.empty();
		}
		try {
			ModelDecision parsed = objectMapper.readValue(text, ModelDecision.class);
			if (parsed == null) {
				return Optional.empty();
			}
			return Optional.of(new DecisionRecord(parsed.text, parsed.promote, parsed.confidence));
		} catch (JsonProcessingException e) {
			logger.debug("Not a decision object: {}", e.getOriginalMessage());
			return Optional.empty();
		}
	}

	/**
	 * The three fields the model is asked for; anything else it adds is ignored
	 */
	@JsonIgnoreProperties(ignoreUnknown = true)
	static class ModelDecision {
		public String text;
		public boolean promote;
		public int confidence;
	}
}
