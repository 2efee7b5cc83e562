package com.EconLake.indicator_pipeline.storage;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import com.EconLake.indicator_pipeline.config.PipelineProperties;

/**
 * Builds artifact keys from the configured tier prefixes.
 */
public class ArtifactLayout {

	private static final DateTimeFormatter FILE_TIMESTAMP =
			DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

	private final PipelineProperties.Storage storage;

	public ArtifactLayout(PipelineProperties.Storage storage) {
		this.storage = storage;
	}

	public String bronzeKey(String indicator, Instant ingestTs, String runId) {
		return storage.bronzePrefix() + "/" + indicator + "/" + indicator + "_" + stamp(ingestTs, runId) + ".json";
	}

	public String silverSeriesKey(String indicator) {
		return storage.silverPrefix() + "/" + indicator + "/" + indicator + "_series.json";
	}

	public String quarantineKey(String indicator, Instant ingestTs, String runId) {
		return storage.quarantinePrefix() + "/" + indicator + "/" + indicator + "_quarantine_"
				+ stamp(ingestTs, runId) + ".json";
	}

	public String quarantinePrefix(String indicator) {
		return storage.quarantinePrefix() + "/" + indicator + "/";
	}

	public String technicalKey(String indicator) {
		return storage.goldPrefix() + "/technical/" + indicator + "_indicators.json";
	}

	public String seasonalKey(String indicator) {
		return storage.goldPrefix() + "/seasonal/" + indicator + "_patterns.json";
	}

	public String monthlyKey(String indicator) {
		return storage.goldPrefix() + "/aggregations/" + indicator + "_monthly.json";
	}

	public String yearlyKey(String indicator) {
		return storage.goldPrefix() + "/aggregations/" + indicator + "_yearly.json";
	}

	public String dailyKey(String indicator) {
		return storage.goldPrefix() + "/" + indicator + "/daily/" + indicator + "_daily.json";
	}

	public String metadataKey(String indicator) {
		return storage.goldPrefix() + "/" + indicator + "/metadata/" + indicator + "_metadata.json";
	}

	public String summaryKey(String indicator) {
		return storage.goldPrefix() + "/" + indicator + "/summary/" + indicator + "_summary.json";
	}

	private static String stamp(Instant ingestTs, String runId) {
		String shortId = runId.length() > 8 ? runId.substring(0, 8) : runId;
		return FILE_TIMESTAMP.format(ingestTs) + "_" + shortId;
	}
}
