package com.EconLake.indicator_pipeline.health;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.config.SgsApiProperties;
import com.EconLake.indicator_pipeline.connectors.SgsClient;
import com.EconLake.indicator_pipeline.dto.sgs.SgsObservationDto;

/**
 * Health indicator that checks the SGS API is reachable by fetching the latest observation of the first
 * configured series, with a short timeout so the health endpoint never hangs.
 */
@Component
public class SgsApiHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(SgsApiHealthIndicator.class);

	private static final Duration HEALTH_CHECK_TIMEOUT = Duration.ofSeconds(5);

	private final SgsClient sgsClient;
	private final SgsApiProperties apiProperties;
	private final PipelineProperties pipelineProperties;

	public SgsApiHealthIndicator(SgsClient sgsClient, SgsApiProperties apiProperties,
			PipelineProperties pipelineProperties) {
		this.sgsClient = sgsClient;
		this.apiProperties = apiProperties;
		this.pipelineProperties = pipelineProperties;
	}

	@Override
	public Health health() {
		PipelineProperties.IndicatorDefinition sample = pipelineProperties.indicators().values().stream()
				.findFirst()
				.orElse(null);
		if (sample == null) {
			return Health.unknown()
					.withDetail("api", "BCB SGS")
					.withDetail("reason", "no indicator configured")
					.build();
		}

		try {
			List<SgsObservationDto> latest = sgsClient.getLatest(sample.seriesId())
					.timeout(HEALTH_CHECK_TIMEOUT)
					.block();
			return base(Health.up(), sample)
					.withDetail("latestDate", latest == null || latest.isEmpty() ? "none" : latest.get(0).date())
					.build();

		} catch (WebClientResponseException ex) {
			int statusCode = ex.getStatusCode().value();
			logger.warn("SGS health check got HTTP {} for series {}", statusCode, sample.seriesId());
			return base(Health.down(), sample)
					.withDetail("statusCode", statusCode)
					.withDetail("error", ex.getStatusCode().is5xxServerError() ? "SGS unavailable" : "SGS rejected the request")
					.build();

		} catch (RuntimeException ex) {
			logger.warn("SGS health check failed for series {}: {}", sample.seriesId(), ex.toString());
			return base(Health.down(), sample)
					.withDetail("error", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName())
					.build();
		}
	}

	private Health.Builder base(Health.Builder builder, PipelineProperties.IndicatorDefinition sample) {
		return builder
				.withDetail("api", "BCB SGS")
				.withDetail("baseUrl", apiProperties.baseUrl())
				.withDetail("sampleSeries", sample.seriesId());
	}
}
