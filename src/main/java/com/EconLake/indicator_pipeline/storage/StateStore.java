package com.EconLake.indicator_pipeline.storage;

import java.io.IOException;
import java.util.Optional;

import com.EconLake.indicator_pipeline.model.Checkpoint;

/**
 * Holds one checkpoint per indicator.
 */
public interface StateStore {

	Optional<Checkpoint> load(String indicator) throws IOException;

	/**
	 * Replaces the checkpoint only if the stored one still has {@code expectedHash}.
	 * A {@code null} expected hash means no checkpoint may exist yet.
	 *
	 * @return {@code true} if the swap happened, {@code false} if another writer got there first
	 */
	default boolean compareAndSet(String indicator, String expectedHash, Checkpoint next) throws IOException {
		return commitIfCurrent(indicator, expectedHash, next, () -> {
		});
	}

	/**
	 * Runs {@code publication} and then replaces the checkpoint, both while no other writer can move the
	 * indicator's checkpoint. Nothing is published when the stored checkpoint no longer has
	 * {@code expectedHash}. If the publication throws, the checkpoint is left as it was.
	 *
	 * @return {@code true} if the publication ran and the checkpoint advanced, {@code false} if another
	 *         writer got there first
	 */
	boolean commitIfCurrent(String indicator, String expectedHash, Checkpoint next, Publication publication)
			throws IOException;

	@FunctionalInterface
	interface Publication {
		void publish() throws IOException;
	}
}
