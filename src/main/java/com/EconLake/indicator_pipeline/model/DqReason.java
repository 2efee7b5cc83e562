package com.EconLake.indicator_pipeline.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Data quality rejection reasons, in the order the validator checks them.
 */
public enum DqReason {

	MISSING_VALUE("missing_value"),
	NON_NUMERIC("non_numeric"),
	INVALID_DATE("invalid_date"),
	OUT_OF_RANGE("out_of_range"),
	DUPLICATE("duplicate");

	private final String code;

	DqReason(String code) {
		this.code = code;
	}

	@JsonValue
	public String code() {
		return code;
	}
}
