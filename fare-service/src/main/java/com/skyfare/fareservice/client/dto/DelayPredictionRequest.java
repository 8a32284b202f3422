package com.skyfare.fareservice.client.dto;

import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Getter
@Builder
public class DelayPredictionRequest {

	private final String origin;
	private final String destination;
	private final String departureDate;
	private final String departureTime;
	private final String carrierCode;
	private final String flightNumber;
	private final String aircraftCode;

	/** flight duration in minutes, sent as PT{n}M */
	private final Integer durationMinutes;

	public Map<String, String> toQueryParams() {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("originLocationCode", origin.toUpperCase(Locale.ROOT));
		params.put("destinationLocationCode", destination.toUpperCase(Locale.ROOT));
		params.put("departureDate", departureDate);
		params.put("departureTime", departureTime);
		params.put("carrierCode", carrierCode.toUpperCase(Locale.ROOT));
		params.put("flightNumber", flightNumber);

		if (StringUtils.isNotBlank(aircraftCode)) {
			params.put("aircraftCode", aircraftCode);
		}
		if (durationMinutes != null && durationMinutes > 0) {
			params.put("duration", "PT" + durationMinutes + "M");
		}
		return params;
	}
}
