package com.EconLake.indicator_pipeline.exception;

/**
 * The upstream could not be reached within the retry budget (network error, timeout, 429 or 5xx).
 * The run ends without mutating any state; the next trigger retries from the last checkpoint.
 */
public class FetchException extends RuntimeException {
	public FetchException(String message, Throwable cause) {
		super(message, cause);
	}
}
