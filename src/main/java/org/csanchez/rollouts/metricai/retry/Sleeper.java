package org.csanchez.rollouts.metricai.retry;

import org.csanchez.rollouts.metricai.error.AnalysisCancelledException;

import java.time.Duration;

/**
 * Suspension point between retry attempts.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Blocks for {@code wait} unless {@code signal} fires first.
	 *
	 * @throws AnalysisCancelledException when the wait was cut short by cancellation
	 */
	void sleep(Duration wait, CancellationSignal signal);

	Sleeper CANCELLABLE = (wait, signal) -> {
		if (signal.await(wait)) {
			throw new AnalysisCancelledException("retry wait cancelled");
		}
	};
}
