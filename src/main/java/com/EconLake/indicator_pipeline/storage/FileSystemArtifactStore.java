package com.EconLake.indicator_pipeline.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Artifact store backed by a local directory. Keys are '/'-separated paths relative to the root.
 */
public class FileSystemArtifactStore implements ArtifactStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemArtifactStore.class);
	private static final String STAGING_SUFFIX = ".staging-";
	private static final String BACKUP_SUFFIX = ".backup-";

	private final Path root;
	private final ObjectMapper objectMapper;

	public FileSystemArtifactStore(Path root, ObjectMapper objectMapper) {
		this.root = root.toAbsolutePath().normalize();
		this.objectMapper = objectMapper;
	}

	@Override
	public void write(ArtifactBatch batch) throws IOException {
		if (batch.isEmpty()) {
			return;
		}

		Map<Path, byte[]> pending = new LinkedHashMap<>();
		for (ArtifactBatch.Entry entry : batch.entries()) {
			Path target = resolve(entry.key());
			byte[] bytes = objectMapper.writeValueAsBytes(entry.payload());
			if (Files.isDirectory(target)) {
				throw new FileSystemException(entry.key(), null, "Is a directory");
			}
			if (entry.createOnly() && Files.exists(target)) {
				// A retried batch finds its own earlier copy of a create-only key.
				if (Arrays.equals(Files.readAllBytes(target), bytes)) {
					logger.debug("Artifact {} already published with identical content", entry.key());
					continue;
				}
				throw new FileAlreadyExistsException(entry.key());
			}
			pending.put(target, bytes);
		}

		Map<Path, Path> staged = new LinkedHashMap<>();
		try {
			for (Map.Entry<Path, byte[]> artifact : pending.entrySet()) {
				Path target = artifact.getKey();
				Files.createDirectories(target.getParent());
				Path staging = sibling(target, STAGING_SUFFIX);
				Files.write(staging, artifact.getValue());
				staged.put(staging, target);
			}
		} catch (IOException | RuntimeException ex) {
			discard(staged.keySet());
			throw ex;
		}

		publishAll(staged);
		logger.debug("Published {} artifacts under {}", staged.size(), root);
	}

	@Override
	public <T> Optional<T> read(String key, TypeReference<T> type) throws IOException {
		Path path = resolve(key);
		if (!Files.exists(path)) {
			return Optional.empty();
		}
		return Optional.of(objectMapper.readValue(path.toFile(), type));
	}

	@Override
	public List<String> list(String prefix) throws IOException {
		if (!Files.isDirectory(root)) {
			return List.of();
		}
		List<String> keys = new ArrayList<>();
		try (Stream<Path> paths = Files.walk(root)) {
			paths.filter(Files::isRegularFile)
					.map(path -> root.relativize(path).toString().replace('\\', '/'))
					.filter(key -> key.startsWith(prefix) && !isTemporary(key))
					.sorted()
					.forEach(keys::add);
		}
		return keys;
	}

	private static boolean isTemporary(String key) {
		return key.contains(STAGING_SUFFIX) || key.contains(BACKUP_SUFFIX);
	}

	private Path resolve(String key) {
		Path resolved = root.resolve(key).normalize();
		if (!resolved.startsWith(root)) {
			throw new IllegalArgumentException("Artifact key escapes the store root: " + key);
		}
		return resolved;
	}

	/**
	 * Moves every staged file onto its target. Targets that get replaced are first moved aside to a backup
	 * sibling, so a failed move puts every earlier target back the way it was.
	 */
	private void publishAll(Map<Path, Path> staged) throws IOException {
		Deque<Replacement> done = new ArrayDeque<>();
		try {
			for (Map.Entry<Path, Path> stagedFile : staged.entrySet()) {
				Path target = stagedFile.getValue();
				Path backup = null;
				if (Files.exists(target)) {
					backup = sibling(target, BACKUP_SUFFIX);
					move(target, backup);
				}
				done.push(new Replacement(target, backup));
				move(stagedFile.getKey(), target);
			}
		} catch (IOException | RuntimeException ex) {
			rollback(done, ex);
			discard(staged.keySet());
			throw ex;
		}

		List<Path> backups = new ArrayList<>();
		for (Replacement replacement : done) {
			if (replacement.backup() != null) {
				backups.add(replacement.backup());
			}
		}
		discard(backups);
	}

	private void rollback(Deque<Replacement> done, Exception cause) {
		while (!done.isEmpty()) {
			Replacement replacement = done.pop();
			try {
				if (replacement.backup() != null) {
					move(replacement.backup(), replacement.target());
				} else {
					Files.deleteIfExists(replacement.target());
				}
			} catch (IOException restoreEx) {
				logger.error("Could not restore artifact {} after a failed publish", replacement.target(), restoreEx);
				cause.addSuppressed(restoreEx);
			}
		}
	}

	protected void move(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
		} catch (AtomicMoveNotSupportedException ex) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	private static Path sibling(Path target, String suffix) {
		return target.resolveSibling(target.getFileName() + suffix + UUID.randomUUID());
	}

	private void discard(Iterable<Path> paths) {
		for (Path path : paths) {
			try {
				Files.deleteIfExists(path);
			} catch (IOException cleanupEx) {
				logger.warn("Could not remove temporary artifact {}: {}", path, cleanupEx.getMessage());
			}
		}
	}

	private record Replacement(Path target, Path backup) {
	}
}
