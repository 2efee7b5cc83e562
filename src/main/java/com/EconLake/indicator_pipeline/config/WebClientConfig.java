package com.EconLake.indicator_pipeline.config;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;

import io.netty.channel.ChannelOption;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {

	private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

	@Bean
	public WebClient sgsWebClient(SgsApiProperties properties) {
		HttpClient httpClient = HttpClient.create()
				.responseTimeout(properties.responseTimeout())
				.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.connectTimeout().toMillis());

		return WebClient.builder()
				.baseUrl(properties.baseUrl())
				.defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
				.clientConnector(new ReactorClientHttpConnector(httpClient))
				// full history in one body; the default 256KB buffer is too small
				.codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
				.filter(logRequestAndResponseWithLatency())
				.build();
	}

	/**
	 * Logs each SGS call with the requested series path and date window, its status and latency. Error
	 * statuses are logged at warn; transport failures at error with the cause.
	 */
	private ExchangeFilterFunction logRequestAndResponseWithLatency() {
		return (clientRequest, next) -> {
			long startNanos = System.nanoTime();
			URI uri = clientRequest.url();
			String target = uri.getPath() + windowOf(uri);
			logger.debug("SGS request: {} {}", clientRequest.method().name(), target);

			return next.exchange(clientRequest)
					.doOnSuccess(response -> {
						long tookMs = elapsedMillis(startNanos);
						int statusCode = response.statusCode().value();
						if (response.statusCode().isError()) {
							logger.warn("SGS answered HTTP {} for {} after {}ms", statusCode, target, tookMs);
						} else {
							logger.debug("SGS answered HTTP {} for {} after {}ms", statusCode, target, tookMs);
						}
					})
					.doOnError(error -> logger.error("SGS request {} failed after {}ms: {}", target,
							elapsedMillis(startNanos), error.getMessage(), error));
		};
	}

	private static String windowOf(URI uri) {
		String query = uri.getRawQuery();
		if (query == null || !query.contains("dataInicial")) {
			return "";
		}
		return " [" + URLDecoder.decode(query, StandardCharsets.UTF_8) + "]";
	}

	private static long elapsedMillis(long startNanos) {
		return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
	}
}
