package com.EconLake.indicator_pipeline.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON settings shared by every persisted artifact. Nulls are written explicitly and dates as ISO-8601
 * strings, so identical inputs always serialize to identical bytes.
 */
public final class ArtifactJson {

	private ArtifactJson() {
	}

	public static ObjectMapper newMapper() {
		return JsonMapper.builder()
				.addModule(new JavaTimeModule())
				.enable(SerializationFeature.INDENT_OUTPUT)
				.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
				.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
				.serializationInclusion(JsonInclude.Include.ALWAYS)
				.build();
	}
}
