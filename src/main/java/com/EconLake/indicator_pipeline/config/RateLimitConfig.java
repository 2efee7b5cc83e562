package com.EconLake.indicator_pipeline.config;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

@Configuration
public class RateLimitConfig {

	private static final int PERIOD_IN_SECONDS = 60;

	@Bean
	public RateLimiter manualTriggerRateLimiter(PipelineProperties properties) {
		RateLimiterConfig config = RateLimiterConfig.custom()
				.limitForPeriod(properties.trigger().limitPerMinute())
				.limitRefreshPeriod(Duration.ofSeconds(PERIOD_IN_SECONDS))
				.timeoutDuration(Duration.ofSeconds(0))
				.build();

		return RateLimiter.of("manualTrigger", config);
	}
}
