package org.csanchez.rollouts.metricai.a2a;

import org.csanchez.rollouts.metricai.analysis.AnalysisInput;

/**
 * Splits a combined log context back into its stable and canary segments.
 */
public final class LogSplitter {

	private LogSplitter() {
	}

	/**
	 * Stable logs are the text between the two markers and canary logs the text
	 * after the canary marker. If either marker is missing the whole context is
	 * returned as stable logs with empty canary logs.
	 */
	public static SplitLogs split(String logContext) {
		int stableIdx = logContext.indexOf(AnalysisInput.STABLE_MARKER);
		int canaryIdx = logContext.indexOf(AnalysisInput.CANARY_MARKER);

		if (stableIdx == -1 || canaryIdx == -1) {
			return new SplitLogs(logContext, "");
		}

		int stableStart = stableIdx + AnalysisInput.STABLE_MARKER.length();
		// canary marker ahead of the stable one leaves no stable segment
		String stableLogs = canaryIdx >= stableStart ? logContext.substring(stableStart, canaryIdx) : "";
		String canaryLogs = logContext.substring(canaryIdx + AnalysisInput.CANARY_MARKER.length());
		return new SplitLogs(stableLogs, canaryLogs);
	}

	public record SplitLogs(String stableLogs, String canaryLogs) {
	}
}
