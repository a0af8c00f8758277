package org.csanchez.rollouts.metricai.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Decision produced by either analysis mode. {@code rootCause},
 * {@code remediation} and {@code prLink} are only filled in by the delegate.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "text", "promote", "confidence", "rootCause", "remediation", "prLink" })
public class DecisionRecord {

	public static final int MIN_CONFIDENCE = 0;
	public static final int MAX_CONFIDENCE = 100;

	@JsonProperty("text")
	private String narrative = "";

	@JsonProperty("promote")
	private boolean promote;

	@JsonProperty("confidence")
	private int confidence;

	@JsonProperty("rootCause")
	private String rootCause;

	@JsonProperty("remediation")
	private String remediationSummary;

	@JsonProperty("prLink")
	private String changeLink;

	public DecisionRecord() {
	}

	public DecisionRecord(String narrative, boolean promote, int confidence) {
		this.narrative = narrative == null ? "" : narrative;
		this.promote = promote;
		this.confidence = clampConfidence(confidence);
	}

	/**
	 * Zero value returned when the model answered but nothing could be parsed
	 */
	public static DecisionRecord empty() {
		return new DecisionRecord();
	}

	public static int clampConfidence(int confidence) {
		return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, confidence));
	}

	public String getNarrative() {
		return narrative;
	}

	public void setNarrative(String narrative) {
		this.narrative = narrative == null ? "" : narrative;
	}

	public boolean isPromote() {
		return promote;
	}

	public void setPromote(boolean promote) {
		this.promote = promote;
	}

	public int getConfidence() {
		return confidence;
	}

	public void setConfidence(int confidence) {
		this.confidence = clampConfidence(confidence);
	}

	public String getRootCause() {
		return rootCause;
	}

	public void setRootCause(String rootCause) {
		this.rootCause = rootCause;
	}

	public String getRemediationSummary() {
		return remediationSummary;
	}

	public void setRemediationSummary(String remediationSummary) {
		this.remediationSummary = remediationSummary;
	}

	public String getChangeLink() {
		return changeLink;
	}

	public void setChangeLink(String changeLink) {
		this.changeLink = changeLink;
	}

	@Override
	public String toString() {
		return "DecisionRecord{" +
				"promote=" + promote +
				", confidence=" + confidence +
				", rootCause='" + rootCause + '\'' +
				", changeLink='" + changeLink + '\'' +
				'}';
	}
}
