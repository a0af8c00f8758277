package org.csanchez.rollouts.metricai.k8s;

public class PodsNotFoundException extends RuntimeException {

	public PodsNotFoundException(String message) {
		super(message);
	}
}
