package org.csanchez.rollouts.metricai.analysis;

import org.csanchez.rollouts.metricai.error.PermanentUpstreamException;
import org.csanchez.rollouts.metricai.model.ModelApiException;
import org.csanchez.rollouts.metricai.model.ModelCaller;
import org.csanchez.rollouts.metricai.model.ModelResponse;
import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.csanchez.rollouts.metricai.retry.RetryController;
import org.csanchez.rollouts.metricai.retry.RetryHints;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectModelAnalyzerTest {

	private final List<Duration> waits = new ArrayList<>();
	private final RetryController retryController =
			new RetryController(RetryController.defaultBackoff(), (wait, signal) -> waits.add(wait));
	private final List<List<String>> sentSegments = new ArrayList<>();

	private DirectModelAnalyzer analyzerReturning(String text) {
		return analyzer((model, segments, signal) -> {
			sentSegments.add(segments);
			return ModelResponse.ofText(text);
		});
	}

	private DirectModelAnalyzer analyzer(ModelCaller caller) {
		return new DirectModelAnalyzer(caller, retryController, RetryController.DEFAULT_MAX_ATTEMPTS);
	}

	private static AnalysisInput input(String extraGuidance) {
		return AnalysisInput.builder()
				.modelIdentifier("gemini-2.0-flash")
				.logs("stable ok", "canary ok")
				.extraGuidance(extraGuidance)
				.build();
	}

	@Test
	void parsesCleanJsonAnswer() {
		String answer = "{\"text\":\"Both versions healthy\",\"promote\":true,\"confidence\":85}";

		AnalysisOutcome outcome = analyzerReturning(answer).analyze(input(null), new CancellationSignal());

		assertThat(outcome.rawText()).isEqualTo(answer);
		assertThat(outcome.decision().getNarrative()).isEqualTo("Both versions healthy");
		assertThat(outcome.decision().isPromote()).isTrue();
		assertThat(outcome.decision().getConfidence()).isEqualTo(85);
	}

	@Test
	void extractsJsonWrappedInProse() {
		String answer = "Here is the result: {\"text\":\"ok\",\"promote\":true,\"confidence\":80} thanks";

		AnalysisOutcome outcome = analyzerReturning(answer).analyze(input(null), new CancellationSignal());

		assertThat(outcome.decision().getNarrative()).isEqualTo("ok");
		assertThat(outcome.decision().isPromote()).isTrue();
		assertThat(outcome.decision().getConfidence()).isEqualTo(80);
		assertThat(outcome.rawText()).isEqualTo("{\"text\":\"ok\",\"promote\":true,\"confidence\":80}");
	}

	@Test
	void unparseableAnswerGivesEmptyDecisionAndNoError() {
		String answer = "I cannot decide on this one";

		AnalysisOutcome outcome = analyzerReturning(answer).analyze(input(null), new CancellationSignal());

		assertThat(outcome.rawText()).isEqualTo(answer);
		assertThat(outcome.decision().getNarrative()).isEmpty();
		assertThat(outcome.decision().isPromote()).isFalse();
		assertThat(outcome.decision().getConfidence()).isZero();
	}

	@Test
	void extractedObjectThatIsNotADecisionGivesEmptyDecision() {
		String answer = "result: {\"promote\": \"maybe\", \"confidence\": [1]}";

		AnalysisOutcome outcome = analyzerReturning(answer).analyze(input(null), new CancellationSignal());

		assertThat(outcome.rawText()).isEqualTo(answer);
		assertThat(outcome.decision().isPromote()).isFalse();
	}

	@Test
	void clampsConfidenceIntoRange() {
		AnalysisOutcome high = analyzerReturning("{\"text\":\"t\",\"promote\":true,\"confidence\":150}")
				.analyze(input(null), new CancellationSignal());
		AnalysisOutcome low = analyzerReturning("{\"text\":\"t\",\"promote\":false,\"confidence\":-5}")
				.analyze(input(null), new CancellationSignal());

		assertThat(high.decision().getConfidence()).isEqualTo(100);
		assertThat(low.decision().getConfidence()).isZero();
	}

	@Test
	void sendsInstructionsFollowedByLogContext() {
		analyzerReturning("{}").analyze(input(null), new CancellationSignal());

		assertThat(sentSegments).hasSize(1);
		String prompt = sentSegments.get(0).get(0);
		assertThat(prompt).startsWith(DirectModelAnalyzer.INSTRUCTIONS);
		assertThat(prompt).contains(AnalysisInput.STABLE_MARKER + "\nstable ok");
		assertThat(prompt).endsWith(AnalysisInput.CANARY_MARKER + "\ncanary ok");
		assertThat(prompt).doesNotContain("Additional context");
	}

	@Test
	void appendsExtraGuidanceToInstructions() {
		analyzerReturning("{}").analyze(input("Ignore 404 errors"), new CancellationSignal());

		assertThat(sentSegments.get(0).get(0)).contains("\n\nAdditional context: Ignore 404 errors\n\n");
	}

	@Test
	void retriesRateLimitedCallThenParses() {
		AtomicInteger calls = new AtomicInteger();
		DirectModelAnalyzer analyzer = analyzer((model, segments, signal) -> {
			if (calls.incrementAndGet() == 1) {
				throw new ModelApiException(429, ModelApiException.RESOURCE_EXHAUSTED, "slow down",
						List.of(Map.of("@type", RetryHints.TYPE_RETRY_INFO, "retryDelay", "3s")));
			}
			return ModelResponse.ofText("{\"text\":\"ok\",\"promote\":true,\"confidence\":70}");
		});

		AnalysisOutcome outcome = analyzer.analyze(input(null), new CancellationSignal());

		assertThat(calls).hasValue(2);
		assertThat(waits).containsExactly(Duration.ofSeconds(3));
		assertThat(outcome.decision().getConfidence()).isEqualTo(70);
	}

	@Test
	void permanentModelErrorPropagates() {
		DirectModelAnalyzer analyzer = analyzer((model, segments, signal) -> {
			throw new ModelApiException(403, "PERMISSION_DENIED", "API key invalid", List.of());
		});

		assertThatThrownBy(() -> analyzer.analyze(input(null), new CancellationSignal()))
				.isInstanceOf(PermanentUpstreamException.class)
				.hasMessageContaining("API key invalid");
	}
}
