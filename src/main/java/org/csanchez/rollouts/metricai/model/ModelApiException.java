package org.csanchez.rollouts.metricai.model;

import java.util.List;
import java.util.Map;

/**
 * Error returned by the generative model API. Carries the numeric code, the
 * status name and the structured detail entries of the error payload, each
 * tagged by an {@code @type} discriminator.
 */
public class ModelApiException extends RuntimeException {

	public static final String RESOURCE_EXHAUSTED = "RESOURCE_EXHAUSTED";
	private static final int TOO_MANY_REQUESTS = 429;

	private final int code;
	private final String status;
	private final List<Map<String, Object>> details;

	public ModelApiException(int code, String status, String message, List<Map<String, Object>> details) {
		this(code, status, message, details, null);
	}

	public ModelApiException(int code, String status, String message, List<Map<String, Object>> details,
			Throwable cause) {
		super(message, cause);
		this.code = code;
		this.status = status == null ? "" : status;
		this.details = details == null ? List.of() : List.copyOf(details);
	}

	public int getCode() {
		return code;
	}

	public String getStatus() {
		return status;
	}

	public List<Map<String, Object>> getDetails() {
		return details;
	}

	/**
	 * True for HTTP 429 or a RESOURCE_EXHAUSTED status
	 */
	public boolean isRateLimited() {
		return code == TOO_MANY_REQUESTS || RESOURCE_EXHAUSTED.equals(status);
	}
}
