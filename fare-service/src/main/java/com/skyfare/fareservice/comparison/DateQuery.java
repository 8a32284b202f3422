package com.skyfare.fareservice.comparison;

import java.time.LocalDate;

/**
 * One departure date to price, with its return date for round trips.
 */
public record DateQuery(LocalDate departureDate, LocalDate returnDate) {

	/**
	 * A missing or non-positive {@code returnAfterDays} means one-way.
	 */
	public static DateQuery of(LocalDate departureDate, Integer returnAfterDays) {
		if (returnAfterDays == null || returnAfterDays <= 0) {
			return new DateQuery(departureDate, null);
		}
		return new DateQuery(departureDate, departureDate.plusDays(returnAfterDays));
	}
}
