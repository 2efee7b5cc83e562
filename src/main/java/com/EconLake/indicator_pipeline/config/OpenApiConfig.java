package com.EconLake.indicator_pipeline.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;

@Configuration
public class OpenApiConfig {

	@Bean
	public OpenAPI indicatorPipelineOpenAPI() {
		return new OpenAPI()
				.info(new Info()
						.title("Indicator Pipeline Operator API")
						.description("Operator endpoints for the economic indicator pipeline. " +
								"Triggers an ingestion run (change detection, validation and quarantine, analytics) " +
								"for a configured indicator and reports the outcome of the latest run.")
						.version("1.0.0")
						.contact(new Contact()
								.name("EconLake Data Platform")
								.email("data-platform@econlake.local"))
						.license(new License()
								.name("Proprietary")
								.url("https://econlake.local")));
	}
}
