package com.skyfare.fareservice.comparison;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Cheapest offer found for one date. {@code price} is null when the date has no usable offer,
 * in which case {@code error} says why.
 */
@Value
@Builder
public class ComparisonEntry {

	LocalDate departureDate;
	LocalDate returnDate;
	BigDecimal price;
	String currency;
	Integer stops;
	String carrier;
	String carrierCode;
	int offersFound;
	String error;

	public boolean hasPrice() {
		return price != null;
	}
}
