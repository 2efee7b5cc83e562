package com.EconLake.indicator_pipeline.validation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.EconLake.indicator_pipeline.config.PipelineProperties;
import com.EconLake.indicator_pipeline.model.DqReason;
import com.EconLake.indicator_pipeline.model.QuarantineRecord;
import com.EconLake.indicator_pipeline.model.RawObservation;
import com.EconLake.indicator_pipeline.model.ValidatedObservation;
import com.EconLake.indicator_pipeline.model.ValidationOutcome;
import com.EconLake.indicator_pipeline.model.ValidationResult;

/**
 * Turns raw observations into validated observations or quarantine records.
 *
 * <p>Rules are applied in a fixed order and the first failing rule gives the record its only reason:
 * {@code missing_value}, {@code non_numeric}, {@code invalid_date}, {@code out_of_range}, {@code duplicate}.
 * The result depends only on the record and the {@link ValidationRules}.
 */
@Component
public class ObservationValidator {

	private static final Logger logger = LoggerFactory.getLogger(ObservationValidator.class);

	private final Set<String> missingSentinels;

	@Autowired
	public ObservationValidator(PipelineProperties properties) {
		this(properties.validation().missingSentinels());
	}

	public ObservationValidator(List<String> missingSentinels) {
		this.missingSentinels = missingSentinels.stream()
				.map(s -> s.trim().toLowerCase(Locale.ROOT))
				.collect(Collectors.toUnmodifiableSet());
	}

	public ValidationOutcome validate(RawObservation raw, ValidationRules rules) {
		String value = raw.rawValue();
		if (value == null || value.isBlank() || missingSentinels.contains(value.trim().toLowerCase(Locale.ROOT))) {
			return quarantine(raw, DqReason.MISSING_VALUE);
		}

		Optional<BigDecimal> number = RawValues.parseNumber(value);
		if (number.isEmpty()) {
			return quarantine(raw, DqReason.NON_NUMERIC);
		}

		Optional<LocalDate> date = RawValues.parseDate(raw.refDate());
		if (date.isEmpty()) {
			return quarantine(raw, DqReason.INVALID_DATE);
		}

		double parsed = number.get().doubleValue();
		if (!Double.isFinite(parsed) || parsed < rules.minValue() || parsed > rules.maxValue()) {
			return quarantine(raw, DqReason.OUT_OF_RANGE);
		}

		if (rules.existingDates().contains(date.get()) && !rules.authorizedRevisions().contains(date.get())) {
			return quarantine(raw, DqReason.DUPLICATE);
		}

		return new ValidationOutcome.Validated(new ValidatedObservation(date.get(), parsed, raw.ingestTs()));
	}

	/**
	 * Validates a batch in arrival order. Within the batch the first accepted record for a date wins, and a
	 * revision authorizes a single overwrite; later records for that date are duplicates.
	 */
	public ValidationResult validateAll(List<RawObservation> batch, ValidationRules rules) {
		Set<LocalDate> known = new HashSet<>(rules.existingDates());
		Set<LocalDate> authorized = new HashSet<>(rules.authorizedRevisions());
		List<ValidatedObservation> validated = new ArrayList<>();
		List<QuarantineRecord> quarantined = new ArrayList<>();

		for (RawObservation raw : batch) {
			ValidationOutcome outcome = validate(raw,
					new ValidationRules(rules.minValue(), rules.maxValue(), known, authorized));
			if (outcome instanceof ValidationOutcome.Validated accepted) {
				LocalDate date = accepted.observation().refDate();
				known.add(date);
				authorized.remove(date);
				validated.add(accepted.observation());
			} else if (outcome instanceof ValidationOutcome.Quarantined rejected) {
				quarantined.add(rejected.record());
			}
		}

		validated.sort(Comparator.comparing(ValidatedObservation::refDate));
		if (!quarantined.isEmpty()) {
			Map<DqReason, Long> byReason = quarantined.stream()
					.collect(Collectors.groupingBy(QuarantineRecord::dqReason, () -> new EnumMap<>(DqReason.class),
							Collectors.counting()));
			logger.warn("Quarantined {} of {} records: {}", quarantined.size(), batch.size(), byReason);
		}
		return new ValidationResult(validated, quarantined);
	}

	private static ValidationOutcome quarantine(RawObservation raw, DqReason reason) {
		return new ValidationOutcome.Quarantined(QuarantineRecord.of(raw, reason));
	}
}
