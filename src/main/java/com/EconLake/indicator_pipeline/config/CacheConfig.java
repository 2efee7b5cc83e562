package com.EconLake.indicator_pipeline.config;

import java.util.concurrent.TimeUnit;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import com.EconLake.indicator_pipeline.service.RunReport;

/**
 * In-memory cache of the latest run report per indicator, read by the operator endpoint.
 * It never feeds back into a run.
 */
@Configuration
public class CacheConfig {

	@Bean
	public Cache<String, RunReport> runReportCache() {
		return Caffeine.newBuilder()
				.maximumSize(500)
				.expireAfterWrite(24, TimeUnit.HOURS)
				.recordStats()
				.build();
	}
}
