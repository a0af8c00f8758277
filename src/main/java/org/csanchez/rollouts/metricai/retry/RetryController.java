package org.csanchez.rollouts.metricai.retry;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import org.csanchez.rollouts.metricai.error.AnalysisCancelledException;
import org.csanchez.rollouts.metricai.error.PermanentUpstreamException;
import org.csanchez.rollouts.metricai.error.RetryExhaustedException;
import org.csanchez.rollouts.metricai.model.ModelApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Retries model calls that were rate limited, with exponential backoff that
 * yields to server supplied retry hints. Any other failure is permanent.
 */
public class RetryController {

	private static final Logger logger = LoggerFactory.getLogger(RetryController.class);

	public static final int DEFAULT_MAX_ATTEMPTS = 3;

	private final IntervalFunction backoff;
	private final Sleeper sleeper;
	// only rate limiting is worth another attempt
	private final RetryConfig retryConfig;

	public RetryController(IntervalFunction backoff) {
		this(backoff, Sleeper.CANCELLABLE);
	}

	public RetryController(IntervalFunction backoff, Sleeper sleeper) {
		this.backoff = backoff;
		this.sleeper = sleeper;
		this.retryConfig = RetryConfig.custom()
				.retryOnException(RetryController::isRateLimited)
				.build();
	}

	/**
	 * 1s initial, x2, capped at 60s, +/-10% jitter
	 */
	public static IntervalFunction defaultBackoff() {
		return IntervalFunction.ofExponentialRandomBackoff(Duration.ofSeconds(1), 2.0, 0.1, Duration.ofSeconds(60));
	}

	static boolean isRateLimited(Throwable error) {
		return error instanceof ModelApiException && ((ModelApiException) error).isRateLimited();
	}

	/**
	 * Runs {@code operation} until it succeeds, fails permanently, or
	 * {@code maxAttempts} rate-limited attempts have been made.
	 *
	 * @throws PermanentUpstreamException on the first error that is not rate limiting
	 * @throws RetryExhaustedException    when every attempt was rate limited
	 * @throws AnalysisCancelledException when {@code signal} fires
	 */
	public <T> T execute(Callable<T> operation, int maxAttempts, CancellationSignal signal) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		RetryState state = new RetryState(backoff);

		while (true) {
			signal.throwIfCancelled("model call");
			int attempt = state.nextAttempt();
			try {
				return operation.call();
			} catch (AnalysisCancelledException e) {
				throw e;
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new AnalysisCancelledException("model call interrupted");
			} catch (Exception e) {
				signal.throwIfCancelled("model call");

				if (!retryConfig.getExceptionPredicate().test(e)) {
					logApiError(e);
					throw new PermanentUpstreamException(attempt, e);
				}

				ModelApiException apiError = (ModelApiException) e;
				logApiError(apiError);
				inspectRateLimit(apiError, state);

				if (attempt >= maxAttempts) {
					throw new RetryExhaustedException(attempt, e);
				}

				Duration wait = state.nextWait();
				logger.debug("Waiting {} ms before attempt {}", wait.toMillis(), attempt + 1);
				sleeper.sleep(wait, signal);
			}
		}
	}

	private void inspectRateLimit(ModelApiException apiError, RetryState state) {
		for (RetryHints.QuotaViolation violation : RetryHints.quotaViolations(apiError.getDetails())) {
			logger.warn("Quota violation - API rate limit exceeded: quotaMetric={}, quotaId={}, quotaValue={}, quotaDimensions={}",
					violation.quotaMetric(), violation.quotaId(), violation.quotaValue(),
					violation.quotaDimensions());
		}

		Optional<Duration> hint = RetryHints.retryDelay(apiError.getDetails());
		if (hint.isPresent()) {
			logger.warn("Rate limit exceeded on attempt {}, using API-suggested wait time {}",
					state.getAttempt(), hint.get());
			state.suggestWait(hint.get());
		} else {
			logger.warn("Rate limit exceeded on attempt {}, using exponential backoff", state.getAttempt());
		}
	}

	private static void logApiError(Exception e) {
		if (e instanceof ModelApiException) {
			ModelApiException apiError = (ModelApiException) e;
			logger.error("Gemini API error: code={}, message={}, status={}",
					apiError.getCode(), apiError.getMessage(), apiError.getStatus());
		} else {
			logger.error("Model call failed: {}", e.getMessage());
		}
	}
}
