package org.csanchez.rollouts.metricai.error;

/**
 * The model API kept rate limiting until the attempt budget ran out.
 */
public class RetryExhaustedException extends UpstreamException {

	public RetryExhaustedException(int attempts, Throwable lastError) {
		super(String.format("max retries exceeded after %d attempts, last error: %s",
				attempts, lastError.getMessage()), attempts, lastError);
	}
}
