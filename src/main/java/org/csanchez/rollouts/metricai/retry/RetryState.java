package org.csanchez.rollouts.metricai.retry;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Progress of a single retried call. Created when the call starts and dropped when it ends.
 */
class RetryState {

	private final IntervalFunction backoff;

	private int attempt;
	private int backoffStep;
	private Duration suggestedWait;

	RetryState(IntervalFunction backoff) {
		this.backoff = backoff;
	}

	int nextAttempt() {
		return ++attempt;
	}

	int getAttempt() {
		return attempt;
	}

	/**
	 * Pins the next wait to a server supplied value
	 */
	void suggestWait(Duration wait) {
		this.suggestedWait = wait;
	}

	/**
	 * Wait before the next attempt. A server suggested wait is used verbatim and
	 * consumed without advancing the backoff schedule; otherwise the next
	 * interval of the schedule is used.
	 */
	Duration nextWait() {
		if (suggestedWait != null) {
			Duration wait = suggestedWait;
			suggestedWait = null;
			return wait;
		}
		return Duration.ofMillis(backoff.apply(++backoffStep));
	}
}
