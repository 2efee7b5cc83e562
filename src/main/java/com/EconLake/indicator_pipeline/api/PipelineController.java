package com.EconLake.indicator_pipeline.api;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.EconLake.indicator_pipeline.config.PipelineProperties.UnknownIndicatorException;
import com.EconLake.indicator_pipeline.exception.FetchException;
import com.EconLake.indicator_pipeline.exception.PersistenceException;
import com.EconLake.indicator_pipeline.exception.RateLimitExceededException;
import com.EconLake.indicator_pipeline.exception.UpstreamParseException;
import com.EconLake.indicator_pipeline.service.PipelineService;
import com.EconLake.indicator_pipeline.service.RunReport;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/pipeline")
@Tag(name = "Pipeline", description = "Operator endpoints for indicator pipeline runs")
public class PipelineController {

	private final PipelineService pipelineService;

	public PipelineController(PipelineService pipelineService) {
		this.pipelineService = pipelineService;
	}

	@Operation(
			summary = "Trigger a pipeline run",
			description = "Fetches the full upstream series for the indicator, detects changes against the last " +
					"checkpoint and, when something changed, validates, quarantines, recomputes analytics and " +
					"commits a new checkpoint. A trigger arriving while a run is in flight joins that run.")
	@ApiResponses(value = {
			@ApiResponse(
					responseCode = "200",
					description = "Run finished (COMMITTED, NO_CHANGE or CONFLICT)",
					content = @Content(schema = @Schema(implementation = RunReport.class))),
			@ApiResponse(
					responseCode = "404",
					description = "Indicator not configured",
					content = @Content),
			@ApiResponse(
					responseCode = "429",
					description = "Too many requests - manual trigger rate limit exceeded",
					content = @Content),
			@ApiResponse(
					responseCode = "502",
					description = "Upstream unreachable after retries, or returned a malformed payload",
					content = @Content),
			@ApiResponse(
					responseCode = "500",
					description = "Artifacts could not be persisted; checkpoint not advanced",
					content = @Content)
	})
	@PostMapping("/{indicator}/runs")
	public Mono<ResponseEntity<RunReport>> triggerRun(
			@Parameter(description = "Configured indicator name", required = true, example = "usdbrl")
			@PathVariable String indicator) {
		return pipelineService.trigger(indicator)
				.map(report -> ResponseEntity.ok(report))
				.onErrorResume(RateLimitExceededException.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
							.body((RunReport) null)))
				.onErrorResume(UnknownIndicatorException.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.NOT_FOUND)
							.body((RunReport) null)))
				.onErrorResume(FetchException.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
							.body((RunReport) null)))
				.onErrorResume(UpstreamParseException.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.BAD_GATEWAY)
							.body((RunReport) null)))
				.onErrorResume(PersistenceException.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
							.body((RunReport) null)))
				.onErrorResume(Exception.class, ex ->
					Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
							.body((RunReport) null)));
	}

	@Operation(
			summary = "Get the latest run report",
			description = "Returns the most recent run report for the indicator seen by this instance " +
					"(kept for 24 hours).")
	@ApiResponses(value = {
			@ApiResponse(
					responseCode = "200",
					description = "Latest run report",
					content = @Content(schema = @Schema(implementation = RunReport.class))),
			@ApiResponse(
					responseCode = "404",
					description = "No run recorded for this indicator",
					content = @Content)
	})
	@GetMapping("/{indicator}/runs/latest")
	public Mono<ResponseEntity<RunReport>> latestRun(
			@Parameter(description = "Configured indicator name", required = true, example = "usdbrl")
			@PathVariable String indicator) {
		return Mono.just(pipelineService.latest(indicator)
				.map(ResponseEntity::ok)
				.orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body((RunReport) null)));
	}
}
