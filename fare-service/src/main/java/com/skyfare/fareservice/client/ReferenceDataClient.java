package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.dto.DelayPredictionRequest;
import com.skyfare.fareservice.client.dto.LocationSubType;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ReferenceDataClient {

	private final RequestDispatcher dispatcher;

	public JsonNode locations(String keyword, LocationSubType subType) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("keyword", keyword);
		params.put("subType", (subType != null ? subType : LocationSubType.BOTH).getQueryValue());
		return get(AmadeusConstants.LOCATIONS_PATH, params);
	}

	/**
	 * @param codes comma-separated IATA or ICAO airline codes
	 */
	public JsonNode airlines(String codes) {
		return get(AmadeusConstants.AIRLINES_PATH, Map.of("airlineCodes", codes.toUpperCase(Locale.ROOT)));
	}

	public JsonNode airportRoutes(String airportCode, int max) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("departureAirportCode", airportCode.toUpperCase(Locale.ROOT));
		params.put("max", String.valueOf(max));
		return get(AmadeusConstants.AIRPORT_ROUTES_PATH, params);
	}

	public JsonNode airlineRoutes(String airlineCode, int max) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("airlineCode", airlineCode.toUpperCase(Locale.ROOT));
		params.put("max", String.valueOf(max));
		return get(AmadeusConstants.AIRLINE_ROUTES_PATH, params);
	}

	public JsonNode checkinLinks(String airlineCode, String language) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("airlineCode", airlineCode.toUpperCase(Locale.ROOT));
		params.put("language", language != null ? language : AmadeusConstants.DEFAULT_CHECKIN_LANGUAGE);
		return get(AmadeusConstants.CHECKIN_LINKS_PATH, params);
	}

	public JsonNode delayPrediction(DelayPredictionRequest request) {
		return get(AmadeusConstants.DELAY_PREDICTION_PATH, request.toQueryParams());
	}

	private JsonNode get(String path, Map<String, String> params) {
		return dispatcher.executeOrThrow(ApiRequest.get(path, CallType.METADATA, params));
	}
}
