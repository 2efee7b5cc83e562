package com.EconLake.indicator_pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IndicatorPipelineApplication {

	public static void main(String[] args) {
		SpringApplication.run(IndicatorPipelineApplication.class, args);
	}
}
