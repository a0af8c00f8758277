package org.csanchez.rollouts.metricai.retry;

import org.csanchez.rollouts.metricai.error.AnalysisCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation shared by every call made for one analysis.
 * Waits between retries return early once cancelled, and registered callbacks
 * abort in-flight HTTP calls.
 */
public class CancellationSignal {

	private static final Logger logger = LoggerFactory.getLogger(CancellationSignal.class);

	private final AtomicBoolean cancelled = new AtomicBoolean(false);
	private final CountDownLatch latch = new CountDownLatch(1);
	private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

	public void cancel() {
		if (!cancelled.compareAndSet(false, true)) {
			return;
		}
		latch.countDown();
		for (Runnable callback : List.copyOf(callbacks)) {
			// whoever removes the callback runs it, so it runs at most once
			if (!callbacks.remove(callback)) {
				continue;
			}
			try {
				callback.run();
			} catch (RuntimeException e) {
				logger.warn("Cancellation callback failed: {}", e.getMessage());
			}
		}
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	/**
	 * Throws if the signal has already fired
	 */
	public void throwIfCancelled(String operation) {
		if (isCancelled()) {
			throw new AnalysisCancelledException(operation + " cancelled");
		}
	}

	/**
	 * Waits up to {@code timeout}. Returns true when the wait ended because of
	 * cancellation. An interrupt of the waiting thread counts as cancellation.
	 */
	public boolean await(Duration timeout) {
		try {
			return latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			cancel();
			return true;
		}
	}

	/**
	 * Runs {@code callback} on cancellation, immediately if already cancelled.
	 * Closing the returned registration removes the callback.
	 */
	public Registration onCancel(Runnable callback) {
		callbacks.add(callback);
		if (isCancelled() && callbacks.remove(callback)) {
			callback.run();
		}
		return () -> callbacks.remove(callback);
	}

	public interface Registration extends AutoCloseable {
		@Override
		void close();
	}
}
