package org.csanchez.rollouts.metricai.error;

/**
 * The model API failed with an error that is not worth retrying (anything but rate limiting).
 */
public class PermanentUpstreamException extends UpstreamException {

	public PermanentUpstreamException(int attempts, Throwable cause) {
		super(String.format("model call failed permanently after %d attempt(s): %s",
				attempts, cause.getMessage()), attempts, cause);
	}
}
