package com.EconLake.indicator_pipeline.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;
import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.EconLake.indicator_pipeline.storage.ArtifactJson;
import com.EconLake.indicator_pipeline.storage.ArtifactLayout;
import com.EconLake.indicator_pipeline.storage.ArtifactStore;
import com.EconLake.indicator_pipeline.storage.FileSystemArtifactStore;
import com.EconLake.indicator_pipeline.storage.FileSystemStateStore;
import com.EconLake.indicator_pipeline.storage.StateStore;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * Wires the durable stores, the persistence retry policy and the run clock.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties({ PipelineProperties.class, SgsApiProperties.class })
public class PipelineConfig {

	@Bean
	public Clock pipelineClock() {
		return Clock.systemUTC();
	}

	@Bean
	public ArtifactLayout artifactLayout(PipelineProperties properties) {
		return new ArtifactLayout(properties.storage());
	}

	@Bean
	public ArtifactStore artifactStore(PipelineProperties properties) {
		return new FileSystemArtifactStore(Path.of(properties.storage().root()), ArtifactJson.newMapper());
	}

	@Bean
	public StateStore stateStore(PipelineProperties properties) {
		Path checkpoints = Path.of(properties.storage().root()).resolve(properties.storage().checkpointPrefix());
		return new FileSystemStateStore(checkpoints, ArtifactJson.newMapper());
	}

	@Bean
	public Retry artifactWriteRetry(PipelineProperties properties) {
		PipelineProperties.Persistence persistence = properties.persistence();
		RetryConfig config = RetryConfig.custom()
				.maxAttempts(persistence.maxAttempts())
				.intervalFunction(IntervalFunction.ofExponentialBackoff(
						persistence.initialBackoff(), persistence.backoffMultiplier()))
				.retryExceptions(IOException.class, UncheckedIOException.class)
				.ignoreExceptions(FileAlreadyExistsException.class)
				.build();
		return Retry.of("artifactWrite", config);
	}
}
