package com.skyfare.fareservice.client.dto;

import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Query for {@code GET /v2/shopping/flight-offers}.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class FlightSearchRequest {

	private final String origin;
	private final String destination;
	private final LocalDate departureDate;
	private final LocalDate returnDate;

	@Builder.Default
	private final int adults = 1;

	@Builder.Default
	private final int children = 0;

	@Builder.Default
	private final int infants = 0;

	private final TravelClass travelClass;

	@Builder.Default
	private final boolean nonStop = false;

	@Builder.Default
	private final int maxResults = 20;

	private final Integer maxPrice;

	@Builder.Default
	private final String currency = AmadeusConstants.DEFAULT_CURRENCY;

	/**
	 * Optional parameters are only sent when set; {@code max} is capped at 250.
	 */
	public Map<String, String> toQueryParams() {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("originLocationCode", origin.toUpperCase(Locale.ROOT));
		params.put("destinationLocationCode", destination.toUpperCase(Locale.ROOT));
		params.put("departureDate", departureDate.toString());
		params.put("adults", String.valueOf(adults));
		params.put("currencyCode", currency);
		params.put("max", String.valueOf(Math.min(maxResults, AmadeusConstants.MAX_FLIGHT_OFFERS)));

		if (returnDate != null) {
			params.put("returnDate", returnDate.toString());
		}
		if (children > 0) {
			params.put("children", String.valueOf(children));
		}
		if (infants > 0) {
			params.put("infants", String.valueOf(infants));
		}
		if (travelClass != null) {
			params.put("travelClass", travelClass.name());
		}
		if (nonStop) {
			params.put("nonStop", "true");
		}
		if (maxPrice != null && maxPrice > 0) {
			params.put("maxPrice", String.valueOf(maxPrice));
		}
		return params;
	}
}
