package com.EconLake.indicator_pipeline.service;

public enum RunStatus {
	/** Artifacts written and the checkpoint advanced. */
	COMMITTED,
	/** Upstream matched the checkpoint; nothing written. */
	NO_CHANGE,
	/** Artifacts written but another run advanced the checkpoint first. */
	CONFLICT
}
