package com.skyfare.fareservice.client.dto;

import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Query shared by the cheapest-dates and inspiration (destinations) searches.
 * {@code destination} is ignored by the inspiration search.
 * {@code departureDate} is a date or a "from,to" range.
 */
@Getter
@Builder
public class FlightDatesRequest {

	private final String origin;
	private final String destination;
	private final String departureDate;
	private final Boolean oneWay;
	private final Integer duration;
	private final boolean nonStop;
	private final Integer maxPrice;
	private final String viewBy;

	@Builder.Default
	private final String currency = AmadeusConstants.DEFAULT_CURRENCY;

	public Map<String, String> toQueryParams(boolean includeDestination) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("origin", origin.toUpperCase(Locale.ROOT));
		if (includeDestination) {
			params.put("destination", destination.toUpperCase(Locale.ROOT));
		}
		params.put("currency", currency);

		if (StringUtils.isNotBlank(departureDate)) {
			params.put("departureDate", departureDate);
		}
		if (oneWay != null) {
			params.put("oneWay", oneWay.toString());
		}
		if (duration != null && duration > 0) {
			params.put("duration", duration.toString());
		}
		if (nonStop) {
			params.put("nonStop", "true");
		}
		if (maxPrice != null && maxPrice > 0) {
			params.put("maxPrice", maxPrice.toString());
		}
		if (StringUtils.isNotBlank(viewBy)) {
			params.put("viewBy", viewBy.toUpperCase(Locale.ROOT));
		}
		return params;
	}
}
