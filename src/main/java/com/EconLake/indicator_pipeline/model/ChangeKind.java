package com.EconLake.indicator_pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChangeKind {

	COLD_START("cold_start"),
	APPEND("append"),
	REVISION("revision"),
	NONE("none");

	private final String code;

	ChangeKind(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}
}
