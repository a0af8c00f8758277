package org.csanchez.rollouts.metricai.measurement;

import org.csanchez.rollouts.metricai.retry.CancellationSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST surface of the metric provider
 */
@RestController
@RequestMapping("/metric")
public class MetricController {

	private static final Logger logger = LoggerFactory.getLogger(MetricController.class);

	private final CanaryMetricProvider provider;

	public MetricController(CanaryMetricProvider provider) {
		this.provider = provider;
	}

	@GetMapping("/type")
	public ResponseEntity<Map<String, String>> type() {
		return ResponseEntity.ok(Map.of("type", provider.type()));
	}

	/**
	 * Runs a measurement synchronously. Analysis failures come back as an
	 * Error measurement with status 200, the way Argo Rollouts expects them.
	 */
	@PostMapping("/run")
	public ResponseEntity<Measurement> run(@RequestBody MetricRunRequest request) {
		logger.info("Received measurement request for analysisRun: {}", request.getAnalysisRunName());
		CancellationSignal signal = new CancellationSignal();
		try {
			return ResponseEntity.ok(provider.run(request, signal));
		} finally {
			// aborts anything still in flight if the request thread is unwinding early
			signal.cancel();
		}
	}

	@PostMapping("/metadata")
	public ResponseEntity<Map<String, String>> metadata(@RequestBody(required = false) MetricPluginConfig config) {
		return ResponseEntity.ok(provider.metadata(config));
	}
}
