package org.csanchez.rollouts.metricai.measurement;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One metric measurement as reported back to Argo Rollouts
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class Measurement {
	private MeasurementPhase phase;
	private String value;
	private String message;
	private Map<String, String> metadata = new LinkedHashMap<>();
	private Instant startedAt;
	private Instant finishedAt;

	public MeasurementPhase getPhase() {
		return phase;
	}

	public void setPhase(MeasurementPhase phase) {
		this.phase = phase;
	}

	public String getValue() {
		return value;
	}

	public void setValue(String value) {
		this.value = value;
	}

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public Map<String, String> getMetadata() {
		return metadata;
	}

	public void setMetadata(Map<String, String> metadata) {
		this.metadata = metadata;
	}

	public Instant getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(Instant startedAt) {
		this.startedAt = startedAt;
	}

	public Instant getFinishedAt() {
		return finishedAt;
	}

	public void setFinishedAt(Instant finishedAt) {
		this.finishedAt = finishedAt;
	}
}
