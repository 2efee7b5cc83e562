package com.EconLake.indicator_pipeline.scheduling;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.service.PipelineService;
import com.EconLake.indicator_pipeline.service.RunReport;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Fetch tick: runs every configured indicator on the pipeline cron. Indicators run in parallel and a
 * failing indicator does not stop the others.
 */
@Component
public class PipelineScheduler {

	private static final Logger logger = LoggerFactory.getLogger(PipelineScheduler.class);

	private final PipelineService pipelineService;

	public PipelineScheduler(PipelineService pipelineService) {
		this.pipelineService = pipelineService;
	}

	@Scheduled(cron = "${pipeline.schedule.cron:0 0 9 * * *}")
	public void tick() {
		logger.info("Fetch tick for {} indicators", pipelineService.indicators().size());
		runAll().subscribe(
				reports -> logger.info("Fetch tick finished: {}", reports.stream()
						.map(r -> r.indicator() + "=" + r.status())
						.toList()),
				ex -> logger.error("Fetch tick aborted", ex));
	}

	Mono<List<RunReport>> runAll() {
		return Flux.fromIterable(pipelineService.indicators())
				.flatMap(indicator -> pipelineService.runScheduled(indicator)
						.onErrorResume(ex -> {
							logger.warn("Scheduled run failed for indicator: {} - {}", indicator, ex.getMessage());
							return Mono.empty();
						}))
				.collectList();
	}
}
