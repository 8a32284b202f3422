package com.skyfare.fareservice.comparison;

import org.apache.commons.lang3.StringUtils;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the list of departure dates a comparison runs over.
 */
public final class DateRangeGenerator {

	private DateRangeGenerator() {
	}

	/**
	 * Every date from {@code start} to {@code end} inclusive that passes {@code filter}, ascending.
	 * Returns an empty list when {@code start} is after {@code end}.
	 */
	public static List<LocalDate> generate(LocalDate start, LocalDate end, DateFilter filter) {
		if (start == null || end == null) {
			throw new IllegalArgumentException("start and end dates are required");
		}
		DateFilter effective = filter != null ? filter : DateFilter.ALL;

		List<LocalDate> dates = new ArrayList<>();
		for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
			if (effective.accepts(d)) {
				dates.add(d);
			}
		}
		return dates;
	}

	/**
	 * Parses a comma-separated list of ISO dates, keeping the given order.
	 */
	public static List<LocalDate> parseDates(String csv) {
		List<LocalDate> dates = new ArrayList<>();
		if (StringUtils.isBlank(csv)) {
			return dates;
		}
		for (String part : csv.split(",")) {
			String trimmed = part.trim();
			if (trimmed.isEmpty()) {
				continue;
			}
			try {
				dates.add(LocalDate.parse(trimmed));
			} catch (DateTimeParseException e) {
				throw new IllegalArgumentException("Invalid date '" + trimmed + "', expected YYYY-MM-DD", e);
			}
		}
		return dates;
	}
}
