package com.EconLake.indicator_pipeline.mapper;

import java.util.List;

import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.dto.artifact.BronzeRecordDto;
import com.EconLake.indicator_pipeline.dto.artifact.QuarantineRecordDto;
import com.EconLake.indicator_pipeline.model.QuarantineRecord;
import com.EconLake.indicator_pipeline.model.RawObservation;

/**
 * Maps pipeline records to the persisted artifact shapes.
 */
@Component
public class ArtifactMapper {

	public List<BronzeRecordDto> toBronze(int seriesId, List<RawObservation> raw) {
		return raw.stream()
				.map(r -> new BronzeRecordDto(seriesId, r.refDate(), r.rawValue(), r.rawPayload(), r.ingestTs()))
				.toList();
	}

	public List<QuarantineRecordDto> toQuarantine(int seriesId, List<QuarantineRecord> records, String sourceFile) {
		return records.stream()
				.map(r -> new QuarantineRecordDto(
						seriesId,
						r.refDate(),
						r.rawValue(),
						r.rawPayload(),
						r.dqStatus(),
						r.dqReason().code(),
						r.ingestTs(),
						sourceFile))
				.toList();
	}
}
