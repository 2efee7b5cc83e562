package com.EconLake.indicator_pipeline.service;

/**
 * Business events raised by the core pipeline, so it can report without knowing how events are recorded.
 */
public interface PipelineEventObserver {

	void onInFlightSharing(String indicator);

	void onRecordsQuarantined(String indicator, int count);

	void onCheckpointConflict(String indicator);
}
