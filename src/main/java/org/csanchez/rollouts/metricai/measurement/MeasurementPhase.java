package org.csanchez.rollouts.metricai.measurement;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Analysis phases understood by Argo Rollouts
 */
public enum MeasurementPhase {
	SUCCESSFUL("Successful"),
	FAILED("Failed"),
	ERROR("Error");

	private final String value;

	MeasurementPhase(String value) {
		this.value = value;
	}

	@JsonValue
	public String getValue() {
		return value;
	}
}
