package com.EconLake.indicator_pipeline.exception;

/**
 * The upstream answered with a payload whose shape cannot be read. Never retried.
 */
public class UpstreamParseException extends RuntimeException {
	public UpstreamParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
