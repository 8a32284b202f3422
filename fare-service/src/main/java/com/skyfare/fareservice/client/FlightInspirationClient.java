package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.dto.FlightDatesRequest;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Cached-fare searches: cheapest dates on a route, cheapest destinations from an origin.
 */
@Component
@RequiredArgsConstructor
public class FlightInspirationClient {

	private final RequestDispatcher dispatcher;

	public JsonNode cheapestDates(FlightDatesRequest request) {
		if (request.getDestination() == null || request.getDestination().isBlank()) {
			throw new IllegalArgumentException("destination is required for a cheapest-dates search");
		}
		return dispatcher.executeOrThrow(
			ApiRequest.get(AmadeusConstants.FLIGHT_DATES_PATH, CallType.SEARCH, request.toQueryParams(true)));
	}

	public JsonNode destinations(FlightDatesRequest request) {
		return dispatcher.executeOrThrow(
			ApiRequest.get(AmadeusConstants.FLIGHT_DESTINATIONS_PATH, CallType.SEARCH, request.toQueryParams(false)));
	}
}
