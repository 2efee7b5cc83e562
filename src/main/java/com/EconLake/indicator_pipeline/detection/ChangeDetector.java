package com.EconLake.indicator_pipeline.detection;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.model.ChangeDecision;
import com.EconLake.indicator_pipeline.model.ChangeKind;
import com.EconLake.indicator_pipeline.model.Checkpoint;
import com.EconLake.indicator_pipeline.model.RawObservation;
import com.EconLake.indicator_pipeline.validation.RawValues;

/**
 * Compares a fresh raw snapshot with the last committed checkpoint and decides whether there is new work.
 *
 * <p>Only records whose reference date parses take part in the comparison; the checkpoint stores the
 * trailing {@code windowSize} of them as they were upstream, so late corrections inside that window are
 * seen as revisions. Revisions win over appends when both are present. Records with unparseable dates
 * ride along in the batch of any changed run so validation can quarantine them.
 */
@Component
public class ChangeDetector {

	private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

	private final int windowSize;

	@Autowired
	public ChangeDetector(PipelineProperties properties) {
		this(properties.detection().windowSize());
	}

	public ChangeDetector(int windowSize) {
		if (windowSize < 1) {
			throw new IllegalArgumentException("windowSize must be at least 1");
		}
		this.windowSize = windowSize;
	}

	/**
	 * @param snapshot   the complete raw series just fetched, in upstream order
	 * @param checkpoint the last committed checkpoint, or {@code null} before the first commit
	 */
	public ChangeDecision detect(List<RawObservation> snapshot, Checkpoint checkpoint) {
		TreeMap<LocalDate, RawObservation> byDate = firstByDate(snapshot);
		if (byDate.isEmpty()) {
			logger.warn("Snapshot has no records with a usable reference date ({} records); nothing to do",
					snapshot.size());
			return ChangeDecision.none();
		}

		if (checkpoint == null || checkpoint.lastRefDate() == null) {
			return new ChangeDecision(ChangeKind.COLD_START, new TreeSet<>(byDate.keySet()), new TreeSet<>(),
					snapshot);
		}

		LocalDate lastRefDate = RawValues.parseDate(checkpoint.lastRefDate())
				.orElseThrow(() -> new IllegalStateException(
						"Checkpoint for " + checkpoint.indicator() + " has an invalid lastRefDate: "
								+ checkpoint.lastRefDate()));

		SortedSet<LocalDate> appended = new TreeSet<>(byDate.tailMap(lastRefDate, false).keySet());
		SortedSet<LocalDate> revised = new TreeSet<>();

		for (Checkpoint.WindowPoint point : windowOf(checkpoint)) {
			Optional<LocalDate> date = RawValues.parseDate(point.refDate());
			if (date.isEmpty()) {
				continue;
			}
			RawObservation current = byDate.get(date.get());
			if (current == null) {
				logger.info("Recorded date {} of {} is no longer published upstream", date.get(),
						checkpoint.indicator());
			} else if (!RawValues.sameValue(current.rawValue(), point.rawValue())) {
				logger.info("Upstream revised {} of {}: {} -> {}", date.get(), checkpoint.indicator(),
						point.rawValue(), current.rawValue());
				revised.add(date.get());
			}
		}

		ChangeKind kind;
		if (!revised.isEmpty()) {
			kind = ChangeKind.REVISION;
		} else if (!appended.isEmpty()) {
			kind = ChangeKind.APPEND;
		} else {
			return ChangeDecision.none();
		}

		List<RawObservation> batch = new ArrayList<>();
		for (RawObservation raw : snapshot) {
			Optional<LocalDate> date = RawValues.parseDate(raw.refDate());
			if (date.isEmpty() || appended.contains(date.get()) || revised.contains(date.get())) {
				batch.add(raw);
			}
		}
		return new ChangeDecision(kind, appended, revised, batch);
	}

	/**
	 * Builds the checkpoint that describes {@code snapshot} once its change has been committed.
	 *
	 * @throws IllegalArgumentException if the snapshot has no record with a usable date
	 */
	public Checkpoint checkpointFor(String indicator, List<RawObservation> snapshot, Instant now) {
		TreeMap<LocalDate, RawObservation> byDate = firstByDate(snapshot);
		if (byDate.isEmpty()) {
			throw new IllegalArgumentException("Snapshot for " + indicator + " has no dated records");
		}
		List<Checkpoint.WindowPoint> window = new ArrayList<>();
		for (Map.Entry<LocalDate, RawObservation> entry : byDate.descendingMap().entrySet()) {
			if (window.size() == windowSize) {
				break;
			}
			window.add(0, new Checkpoint.WindowPoint(entry.getKey().toString(), entry.getValue().rawValue()));
		}
		Map.Entry<LocalDate, RawObservation> last = byDate.lastEntry();
		String lastRefDate = last.getKey().toString();
		return new Checkpoint(indicator, lastRefDate, last.getValue().rawValue(), contentHash(lastRefDate, window),
				now, window);
	}

	/**
	 * SHA-256 over the last reference date and the window, one {@code date=value} line per point.
	 */
	public static String contentHash(String lastRefDate, List<Checkpoint.WindowPoint> window) {
		StringBuilder canonical = new StringBuilder(lastRefDate).append('\n');
		for (Checkpoint.WindowPoint point : window) {
			canonical.append(point.refDate()).append('=')
					.append(point.rawValue() == null ? "" : point.rawValue().trim()).append('\n');
		}
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(canonical.toString().getBytes(StandardCharsets.UTF_8)));
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	public int windowSize() {
		return windowSize;
	}

	private static List<Checkpoint.WindowPoint> windowOf(Checkpoint checkpoint) {
		if (!checkpoint.recordedWindow().isEmpty()) {
			return checkpoint.recordedWindow();
		}
		// Older checkpoints without a window still carry the last point.
		return List.of(new Checkpoint.WindowPoint(checkpoint.lastRefDate(), checkpoint.lastValue()));
	}

	private static TreeMap<LocalDate, RawObservation> firstByDate(List<RawObservation> snapshot) {
		TreeMap<LocalDate, RawObservation> byDate = new TreeMap<>();
		for (RawObservation raw : snapshot) {
			RawValues.parseDate(raw.refDate()).ifPresent(date -> byDate.putIfAbsent(date, raw));
		}
		return byDate;
	}
}
