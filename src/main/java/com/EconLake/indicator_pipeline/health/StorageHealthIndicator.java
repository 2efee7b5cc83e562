package com.EconLake.indicator_pipeline.health;

import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.storage.ArtifactLayout;
import com.EconLake.indicator_pipeline.storage.ArtifactStore;

/**
 * Health indicator for the data lake root: it must exist (or be creatable) and be writable, and the
 * quarantine listing of each indicator must be readable.
 */
@Component
public class StorageHealthIndicator implements HealthIndicator {

	private static final Logger logger = LoggerFactory.getLogger(StorageHealthIndicator.class);

	private final PipelineProperties properties;
	private final ArtifactStore artifactStore;
	private final ArtifactLayout layout;

	public StorageHealthIndicator(PipelineProperties properties, ArtifactStore artifactStore, ArtifactLayout layout) {
		this.properties = properties;
		this.artifactStore = artifactStore;
		this.layout = layout;
	}

	@Override
	public Health health() {
		Path root = Path.of(properties.storage().root()).toAbsolutePath();
		try {
			Files.createDirectories(root);
			if (!Files.isWritable(root)) {
				return Health.down()
						.withDetail("root", root.toString())
						.withDetail("error", "Storage root is not writable")
						.build();
			}

			Health.Builder builder = Health.up().withDetail("root", root.toString());
			for (String indicator : properties.indicators().keySet()) {
				builder.withDetail(indicator + ".quarantineObjects",
						artifactStore.list(layout.quarantinePrefix(indicator)).size());
			}
			return builder.build();

		} catch (Exception ex) {
			logger.error("Storage health check failed", ex);
			return Health.down()
					.withDetail("root", root.toString())
					.withDetail("error", ex.getMessage() != null ? ex.getMessage() : "Unknown error")
					.withDetail("errorType", ex.getClass().getSimpleName())
					.build();
		}
	}
}
