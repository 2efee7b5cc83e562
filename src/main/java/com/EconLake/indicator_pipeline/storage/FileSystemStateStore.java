package com.EconLake.indicator_pipeline.storage;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.EconLake.indicator_pipeline.model.Checkpoint;

/**
 * Checkpoints stored as one JSON file per indicator. A commit holds an in-process lock and an OS file
 * lock for the indicator across the hash check, the publication and the checkpoint write, so it is atomic
 * for threads and for other processes sharing the directory. Different indicators never contend.
 */
public class FileSystemStateStore implements StateStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemStateStore.class);

	private final Path directory;
	private final ObjectMapper objectMapper;
	private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

	public FileSystemStateStore(Path directory, ObjectMapper objectMapper) {
		this.directory = directory.toAbsolutePath().normalize();
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<Checkpoint> load(String indicator) throws IOException {
		Path file = checkpointFile(indicator);
		if (!Files.exists(file)) {
			return Optional.empty();
		}
		return Optional.of(objectMapper.readValue(file.toFile(), Checkpoint.class));
	}

	@Override
	public boolean commitIfCurrent(String indicator, String expectedHash, Checkpoint next, Publication publication)
			throws IOException {
		Files.createDirectories(directory);
		ReentrantLock lock = locks.computeIfAbsent(indicator, key -> new ReentrantLock());
		lock.lock();
		try (FileChannel channel = FileChannel.open(directory.resolve(indicator + ".lock"),
				StandardOpenOption.CREATE, StandardOpenOption.WRITE);
				FileLock ignored = channel.lock()) {

			String currentHash = load(indicator).map(Checkpoint::contentHash).orElse(null);
			if (!Objects.equals(currentHash, expectedHash)) {
				logger.warn("Checkpoint compare-and-swap rejected for {}: expected hash {} but found {}",
						indicator, expectedHash, currentHash);
				return false;
			}

			publication.publish();

			Path target = checkpointFile(indicator);
			Path staging = directory.resolve(indicator + ".json.staging-" + UUID.randomUUID());
			Files.write(staging, objectMapper.writeValueAsBytes(next));
			try {
				Files.move(staging, target, StandardCopyOption.ATOMIC_MOVE);
			} catch (AtomicMoveNotSupportedException ex) {
				Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.debug("Checkpoint for {} advanced to {} ({})", indicator, next.lastRefDate(), next.contentHash());
			return true;
		} finally {
			lock.unlock();
		}
	}

	private Path checkpointFile(String indicator) {
		Path file = directory.resolve(indicator + ".json").normalize();
		if (!file.startsWith(directory)) {
			throw new IllegalArgumentException("Invalid indicator name: " + indicator);
		}
		return file;
	}
}
