package com.EconLake.indicator_pipeline.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.config.PipelineProperties.IndicatorDefinition;
import com.EconLake.indicator_pipeline.config.SgsApiProperties;
import com.EconLake.indicator_pipeline.connectors.SgsClient;
import com.EconLake.indicator_pipeline.dto.sgs.SgsObservationDto;
import com.EconLake.indicator_pipeline.storage.ArtifactBatch;
import com.EconLake.indicator_pipeline.storage.ArtifactJson;
import com.EconLake.indicator_pipeline.storage.ArtifactLayout;
import com.EconLake.indicator_pipeline.storage.FileSystemArtifactStore;

import reactor.core.publisher.Mono;

class HealthIndicatorsTest {

	private static final SgsApiProperties API = new SgsApiProperties(null, null, null, null, null, null, null);

	@TempDir
	Path root;

	@Test
	void sgs_ReachableReportsLatestDate() {
		SgsClient client = mock(SgsClient.class);
		when(client.getLatest(1)).thenReturn(Mono.just(List.of(new SgsObservationDto("08/03/2024", "4.97"))));

		Health health = new SgsApiHealthIndicator(client, API, properties(root)).health();

		assertThat(health.getStatus()).isEqualTo(Status.UP);
		assertThat(health.getDetails()).containsEntry("latestDate", "08/03/2024").containsEntry("sampleSeries", 1);
	}

	@Test
	void sgs_ServerErrorIsDown() {
		SgsClient client = mock(SgsClient.class);
		when(client.getLatest(1)).thenReturn(Mono.error(WebClientResponseException.create(
				HttpStatus.SERVICE_UNAVAILABLE.value(), "Service Unavailable", null, null, null)));

		Health health = new SgsApiHealthIndicator(client, API, properties(root)).health();

		assertThat(health.getStatus()).isEqualTo(Status.DOWN);
		assertThat(health.getDetails()).containsEntry("statusCode", 503);
	}

	@Test
	void storage_WritableRootListsQuarantineObjects() throws IOException {
		PipelineProperties properties = properties(root);
		ArtifactLayout layout = new ArtifactLayout(properties.storage());
		FileSystemArtifactStore store = new FileSystemArtifactStore(root, ArtifactJson.newMapper());
		store.write(new ArtifactBatch().create("quarantine/usdbrl/usdbrl_quarantine_1.json", List.of()));

		Health health = new StorageHealthIndicator(properties, store, layout).health();

		assertThat(health.getStatus()).isEqualTo(Status.UP);
		assertThat(health.getDetails()).containsEntry("usdbrl.quarantineObjects", 1);
	}

	private static PipelineProperties properties(Path root) {
		return new PipelineProperties(
				Map.of("usdbrl", new IndicatorDefinition(1, "USD/BRL", 0.0001, 100.0, LocalDate.of(2024, 1, 1))),
				null, null, null, null,
				new PipelineProperties.Storage(root.toString(), null, null, null, null, null),
				null, null, null);
	}
}
