package com.EconLake.indicator_pipeline.storage;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;

/**
 * Durable store for layered JSON artifacts (bronze, silver, quarantine, gold).
 */
public interface ArtifactStore {

	/**
	 * Publishes every artifact of the batch. Implementations stage all payloads before replacing anything,
	 * so a failure while staging leaves previously published artifacts untouched.
	 */
	void write(ArtifactBatch batch) throws IOException;

	<T> Optional<T> read(String key, TypeReference<T> type) throws IOException;

	/**
	 * Lists the keys under a prefix in lexical order.
	 */
	List<String> list(String prefix) throws IOException;
}
