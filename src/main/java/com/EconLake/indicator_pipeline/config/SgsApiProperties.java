package com.EconLake.indicator_pipeline.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds Banco Central SGS settings from application.properties (sgs.api.*).
 */
@ConfigurationProperties(prefix = "sgs.api")
public record SgsApiProperties(
		String baseUrl,
		Integer windowYears,
		Duration responseTimeout,
		Duration connectTimeout,
		Integer maxRetries,
		Duration initialBackoff,
		Duration maxBackoff) {

	public SgsApiProperties {
		baseUrl = baseUrl == null ? "https://api.bcb.gov.br" : baseUrl;
		windowYears = windowYears == null ? 10 : windowYears;
		responseTimeout = responseTimeout == null ? Duration.ofSeconds(15) : responseTimeout;
		connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
		maxRetries = maxRetries == null ? 3 : maxRetries;
		initialBackoff = initialBackoff == null ? Duration.ofMillis(200) : initialBackoff;
		maxBackoff = maxBackoff == null ? Duration.ofSeconds(2) : maxBackoff;
	}
}
