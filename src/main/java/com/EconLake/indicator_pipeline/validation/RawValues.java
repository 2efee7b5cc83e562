package com.EconLake.indicator_pipeline.validation;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;

/**
 * Parsing rules for upstream text fields, shared by change detection and validation.
 */
public final class RawValues {

	private static final DateTimeFormatter ISO_DATE_STRICT =
			DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

	private RawValues() {
	}

	/**
	 * Parses a calendar date in {@code yyyy-MM-dd} form. Impossible dates such as 2024-02-30 are rejected.
	 */
	public static Optional<LocalDate> parseDate(String text) {
		if (text == null) {
			return Optional.empty();
		}
		try {
			return Optional.of(LocalDate.parse(text.trim(), ISO_DATE_STRICT));
		} catch (DateTimeParseException ex) {
			return Optional.empty();
		}
	}

	/**
	 * Parses a plain decimal number. A decimal comma is accepted when the text has no dot ("5,12").
	 */
	public static Optional<BigDecimal> parseNumber(String text) {
		if (text == null) {
			return Optional.empty();
		}
		String normalized = text.trim();
		if (normalized.indexOf('.') < 0) {
			normalized = normalized.replace(',', '.');
		}
		try {
			return Optional.of(new BigDecimal(normalized));
		} catch (NumberFormatException ex) {
			return Optional.empty();
		}
	}

	/**
	 * Two raw values are the same when they are equal numbers, or the same trimmed text.
	 */
	public static boolean sameValue(String left, String right) {
		if (left == null || right == null) {
			return left == null && right == null;
		}
		if (left.trim().equals(right.trim())) {
			return true;
		}
		Optional<BigDecimal> l = parseNumber(left);
		Optional<BigDecimal> r = parseNumber(right);
		return l.isPresent() && r.isPresent() && l.get().compareTo(r.get()) == 0;
	}
}
