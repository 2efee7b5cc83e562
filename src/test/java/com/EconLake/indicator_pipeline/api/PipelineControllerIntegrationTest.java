package com.EconLake.indicator_pipeline.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClient;

import okhttp3.mockwebserver.Dispatcher;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

/**
 * Integration tests for PipelineController.
 *
 * <p>Runs the real Spring context end to end: HTTP request, controller, rate limiter, pipeline, file
 * stores. Only the SGS API is replaced by a MockWebServer, and every context gets its own storage root.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(PipelineControllerIntegrationTest.MockWebServerConfiguration.class)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class PipelineControllerIntegrationTest {

	private static final String SERIES_PATH = "/dados/serie/bcdata.sgs.1/dados";

	@Autowired
	private ApplicationContext applicationContext;

	@Autowired
	private MockWebServer mockWebServer;

	private Dispatcher originalDispatcher;

	private WebTestClient webTestClient;

	@DynamicPropertySource
	static void storageRoot(DynamicPropertyRegistry registry) {
		registry.add("pipeline.storage.root", PipelineControllerIntegrationTest::newStorageRoot);
	}

	@BeforeEach
	void setUp() {
		webTestClient = WebTestClient.bindToApplicationContext(applicationContext).build();
		originalDispatcher = mockWebServer.getDispatcher();
	}

	@AfterEach
	void tearDown() {
		mockWebServer.setDispatcher(originalDispatcher);
	}

	@Test
	void triggerRun_ColdStart_Returns200WithCommittedReport() {
		webTestClient.post()
				.uri("/api/pipeline/usdbrl/runs")
				.exchange()
				.expectStatus().isOk()
				.expectBody()
				.jsonPath("$.indicator").isEqualTo("usdbrl")
				.jsonPath("$.status").isEqualTo("COMMITTED")
				.jsonPath("$.changeKind").isEqualTo("cold_start")
				.jsonPath("$.fetched").isEqualTo(4)
				.jsonPath("$.validated").isEqualTo(3)
				.jsonPath("$.quarantined").isEqualTo(1)
				.jsonPath("$.seriesLength").isEqualTo(3);
	}

	@Test
	void latestRun_AfterTrigger_ReturnsLastReport() {
		webTestClient.post()
				.uri("/api/pipeline/usdbrl/runs")
				.exchange()
				.expectStatus().isOk();

		webTestClient.get()
				.uri("/api/pipeline/usdbrl/runs/latest")
				.exchange()
				.expectStatus().isOk()
				.expectBody()
				.jsonPath("$.indicator").isEqualTo("usdbrl")
				.jsonPath("$.runId").exists();
	}

	@Test
	void latestRun_NoRunYet_Returns404() {
		webTestClient.get()
				.uri("/api/pipeline/usdbrl/runs/latest")
				.exchange()
				.expectStatus().isNotFound();
	}

	@Test
	void triggerRun_UnknownIndicator_Returns404() {
		webTestClient.post()
				.uri("/api/pipeline/selic/runs")
				.exchange()
				.expectStatus().isNotFound();
	}

	@Test
	void triggerRun_UnknownUpstreamSeries_Returns502() {
		mockWebServer.setDispatcher(new Dispatcher() {
			@Override
			public MockResponse dispatch(RecordedRequest request) {
				return new MockResponse().setResponseCode(404).setBody("Not Found");
			}
		});

		webTestClient.post()
				.uri("/api/pipeline/usdbrl/runs")
				.exchange()
				.expectStatus().isEqualTo(502);
	}

	@Test
	void triggerRun_UpstreamDown_Returns502() {
		mockWebServer.setDispatcher(new Dispatcher() {
			@Override
			public MockResponse dispatch(RecordedRequest request) {
				return new MockResponse().setResponseCode(503).setBody("Service Unavailable");
			}
		});

		webTestClient.post()
				.uri("/api/pipeline/usdbrl/runs")
				.exchange()
				.expectStatus().isEqualTo(502);
	}

	@Test
	void triggerRun_OverRateLimit_Returns429() {
		// limit-per-minute is 3 in the test profile
		for (int i = 0; i < 3; i++) {
			webTestClient.post()
					.uri("/api/pipeline/usdbrl/runs")
					.exchange()
					.expectStatus().isOk();
		}

		webTestClient.post()
				.uri("/api/pipeline/usdbrl/runs")
				.exchange()
				.expectStatus().isEqualTo(429);
	}

	private static String newStorageRoot() {
		try {
			return Files.createTempDirectory("indicator-pipeline-it").toString();
		} catch (IOException ex) {
			throw new UncheckedIOException(ex);
		}
	}

	/**
	 * Replaces the SGS API with a MockWebServer serving a short USD/BRL history with one missing value.
	 */
	@TestConfiguration
	static class MockWebServerConfiguration {

		@Bean
		@Primary
		public MockWebServer mockWebServer() throws IOException {
			MockWebServer server = new MockWebServer();
			server.setDispatcher(new Dispatcher() {
				@Override
				public MockResponse dispatch(RecordedRequest request) {
					String path = request.getPath();
					if (path != null && path.startsWith(SERIES_PATH)) {
						return seriesResponse();
					}
					return new MockResponse().setResponseCode(404);
				}
			});
			server.start();
			return server;
		}

		private MockResponse seriesResponse() {
			String json = """
					[
						{"data": "02/01/2024", "valor": "4.8526"},
						{"data": "03/01/2024", "valor": "4.9212"},
						{"data": "04/01/2024", "valor": ""},
						{"data": "05/01/2024", "valor": "4.8910"}
					]
					""";
			return new MockResponse().setResponseCode(200).setBody(json)
					.addHeader("Content-Type", "application/json");
		}

		@Bean
		@Primary
		public WebClient sgsWebClient(MockWebServer mockWebServer) {
			String baseUrl = mockWebServer.url("/").toString();
			if (baseUrl.endsWith("/")) {
				baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
			}
			return WebClient.builder().baseUrl(baseUrl).build();
		}
	}
}
