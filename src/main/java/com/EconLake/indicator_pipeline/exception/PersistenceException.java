package com.EconLake.indicator_pipeline.exception;

/**
 * Artifacts or the checkpoint could not be written after retries. The checkpoint is not advanced.
 */
public class PersistenceException extends RuntimeException {
	public PersistenceException(String message, Throwable cause) {
		super(message, cause);
	}
}
