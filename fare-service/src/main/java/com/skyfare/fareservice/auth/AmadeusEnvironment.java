package com.skyfare.fareservice.auth;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;

@Getter
@RequiredArgsConstructor
public enum AmadeusEnvironment {

	TEST("test", "https://test.api.amadeus.com"),
	PRODUCTION("production", "https://api.amadeus.com");

	private final String key;
	private final String baseUrl;

	/**
	 * Unknown or missing values select the test host.
	 */
	public static AmadeusEnvironment from(String value) {
		if (value != null && PRODUCTION.key.equals(value.trim().toLowerCase(Locale.ROOT))) {
			return PRODUCTION;
		}
		return TEST;
	}
}
