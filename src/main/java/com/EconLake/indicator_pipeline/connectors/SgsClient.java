package com.EconLake.indicator_pipeline.connectors;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.codec.DecodingException;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.EconLake.indicator_pipeline.config.SgsApiProperties;
import com.EconLake.indicator_pipeline.dto.sgs.SgsObservationDto;
import com.EconLake.indicator_pipeline.exception.FetchException;
import com.EconLake.indicator_pipeline.exception.UpstreamParseException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

@Component
public class SgsClient {

	static final DateTimeFormatter SGS_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
	private static final ParameterizedTypeReference<List<SgsObservationDto>> OBSERVATIONS =
			new ParameterizedTypeReference<>() {
			};

	private final WebClient sgsWebClient;
	private final SgsApiProperties properties;
	private final Clock clock;

	public SgsClient(@Qualifier("sgsWebClient") WebClient sgsWebClient, SgsApiProperties properties, Clock clock) {
		this.sgsWebClient = sgsWebClient;
		this.properties = properties;
		this.clock = clock;
	}

	/**
	 * Fetches the full history of a series from {@code startDate} to today.
	 * The upstream caps the date range of one request, so the range is split into consecutive windows of
	 * {@code sgs.api.window-years} years that are requested in order and concatenated.
	 *
	 * @param seriesId  SGS series code (e.g., 1 for USD-BRL)
	 * @param startDate first date to fetch
	 * @return Mono containing every observation in upstream order
	 */
	public Mono<List<SgsObservationDto>> getSeries(int seriesId, LocalDate startDate) {
		LocalDate today = LocalDate.now(clock);
		return Flux.fromIterable(windows(startDate, today, properties.windowYears()))
				.concatMap(window -> getWindow(seriesId, window[0], window[1]))
				.collectList()
				.map(chunks -> {
					List<SgsObservationDto> all = new ArrayList<>();
					chunks.forEach(all::addAll);
					return all;
				});
	}

	/**
	 * Fetches only the most recent observation of a series. Used by the health check.
	 *
	 * @param seriesId SGS series code
	 * @return Mono containing a list with at most one observation
	 */
	public Mono<List<SgsObservationDto>> getLatest(int seriesId) {
		return sgsWebClient.get()
				.uri(uriBuilder -> uriBuilder
						.path("/dados/serie/bcdata.sgs.{seriesId}/dados/ultimos/1")
						.queryParam("formato", "json")
						.build(seriesId))
				.retrieve()
				.bodyToMono(OBSERVATIONS)
				.defaultIfEmpty(List.of());
	}

	private Mono<List<SgsObservationDto>> getWindow(int seriesId, LocalDate from, LocalDate to) {
		String range = SGS_DATE.format(from) + " to " + SGS_DATE.format(to);
		return sgsWebClient.get()
				.uri(uriBuilder -> uriBuilder
						.path("/dados/serie/bcdata.sgs.{seriesId}/dados")
						.queryParam("formato", "json")
						.queryParam("dataInicial", SGS_DATE.format(from))
						.queryParam("dataFinal", SGS_DATE.format(to))
						.build(seriesId))
				.retrieve()
				.bodyToMono(OBSERVATIONS)
				.defaultIfEmpty(List.of())
				.timeout(properties.responseTimeout())
				.retryWhen(Retry.backoff(properties.maxRetries(), properties.initialBackoff())
						.maxBackoff(properties.maxBackoff())
						.filter(SgsClient::isTransient)
						.onRetryExhaustedThrow((spec, signal) -> new FetchException(
								"SGS series " + seriesId + " unavailable for " + range + " after "
										+ signal.totalRetries() + " retries", signal.failure())))
				.onErrorMap(WebClientResponseException.NotFound.class,
						ex -> new UpstreamParseException("Unknown SGS series: " + seriesId, ex))
				.onErrorMap(DecodingException.class,
						ex -> new UpstreamParseException("Malformed SGS payload for series " + seriesId + " (" + range + ")", ex))
				.onErrorMap(WebClientResponseException.class,
						ex -> new UpstreamParseException("SGS rejected request for series " + seriesId + " (" + range
								+ "): HTTP " + ex.getStatusCode().value(), ex));
	}

	static boolean isTransient(Throwable error) {
		if (error instanceof WebClientResponseException responseError) {
			int status = responseError.getStatusCode().value();
			return status == 429 || status >= 500;
		}
		return error instanceof WebClientRequestException || error instanceof TimeoutException;
	}

	static List<LocalDate[]> windows(LocalDate startDate, LocalDate endDate, int windowYears) {
		List<LocalDate[]> windows = new ArrayList<>();
		LocalDate current = startDate;
		while (!current.isAfter(endDate)) {
			LocalDate capped = current.plusYears(windowYears);
			LocalDate windowEnd = capped.isAfter(endDate) ? endDate : capped;
			windows.add(new LocalDate[] { current, windowEnd });
			current = windowEnd.plusDays(1);
		}
		return windows;
	}
}
