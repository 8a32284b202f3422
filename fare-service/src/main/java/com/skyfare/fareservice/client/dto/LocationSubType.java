package com.skyfare.fareservice.client.dto;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum LocationSubType {

	AIRPORT("AIRPORT"),
	CITY("CITY"),
	BOTH("AIRPORT,CITY");

	private final String queryValue;

	/**
	 * Accepts {@code airport}, {@code city} or {@code both} in any case; blank means both.
	 */
	public static LocationSubType fromValue(String value) {
		if (value == null || value.isBlank()) {
			return BOTH;
		}
		try {
			return valueOf(value.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("subType must be one of airport, city, both", e);
		}
	}
}
