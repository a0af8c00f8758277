package org.csanchez.rollouts.metricai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main Spring Boot application entry point for the AI metric provider.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class MetricAiApplication {

	public static void main(String[] args) {
		SpringApplication.run(MetricAiApplication.class, args);
	}
}
