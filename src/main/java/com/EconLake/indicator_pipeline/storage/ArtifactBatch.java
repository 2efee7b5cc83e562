package com.EconLake.indicator_pipeline.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The set of artifacts one run publishes together. Entries keep insertion order.
 */
public final class ArtifactBatch {

	private final List<Entry> entries = new ArrayList<>();

	/**
	 * Adds an artifact that replaces any previous object under the same key.
	 */
	public ArtifactBatch put(String key, Object payload) {
		return add(key, payload, false);
	}

	/**
	 * Adds an artifact that must not exist yet. Publishing fails rather than overwrite it.
	 */
	public ArtifactBatch create(String key, Object payload) {
		return add(key, payload, true);
	}

	public List<Entry> entries() {
		return Collections.unmodifiableList(entries);
	}

	public List<String> keys() {
		return entries.stream().map(Entry::key).toList();
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	private ArtifactBatch add(String key, Object payload, boolean createOnly) {
		Objects.requireNonNull(key, "key");
		if (entries.stream().anyMatch(e -> e.key().equals(key))) {
			throw new IllegalArgumentException("Artifact already in batch: " + key);
		}
		entries.add(new Entry(key, payload, createOnly));
		return this;
	}

	public record Entry(String key, Object payload, boolean createOnly) {
	}
}
