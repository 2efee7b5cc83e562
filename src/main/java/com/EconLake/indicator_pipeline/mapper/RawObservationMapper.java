package com.EconLake.indicator_pipeline.mapper;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.dto.sgs.SgsObservationDto;
import com.EconLake.indicator_pipeline.model.RawObservation;

/**
 * Maps SGS responses to raw observations.
 */
@Component
public class RawObservationMapper {

	private static final Pattern SGS_DATE = Pattern.compile("(\\d{2})/(\\d{2})/(\\d{4})");

	public List<RawObservation> toRawObservations(List<SgsObservationDto> observations, Instant ingestTs) {
		if (observations == null) {
			return List.of();
		}
		return observations.stream()
				.map(dto -> toRawObservation(dto, ingestTs))
				.toList();
	}

	/**
	 * Converts the upstream {@code dd/MM/yyyy} date to ISO-8601. Anything that does not look like an upstream
	 * date is kept as-is so the validator can quarantine it with {@code invalid_date}; the digits are not
	 * checked here either, so "31/02/2024" becomes "2024-02-31" and is rejected later.
	 */
	RawObservation toRawObservation(SgsObservationDto dto, Instant ingestTs) {
		Map<String, String> payload = new LinkedHashMap<>();
		payload.put("data", dto.date());
		payload.put("valor", dto.value());
		return new RawObservation(toIsoDate(dto.date()), dto.value(), payload, ingestTs);
	}

	static String toIsoDate(String sgsDate) {
		if (sgsDate == null) {
			return null;
		}
		Matcher matcher = SGS_DATE.matcher(sgsDate.trim());
		if (!matcher.matches()) {
			return sgsDate;
		}
		return matcher.group(3) + "-" + matcher.group(2) + "-" + matcher.group(1);
	}
}
