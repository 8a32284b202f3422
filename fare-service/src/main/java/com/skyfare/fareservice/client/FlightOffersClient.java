package com.skyfare.fareservice.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.skyfare.common.exception.SerializationException;
import com.skyfare.fareservice.client.dto.FlightOffersResponse;
import com.skyfare.fareservice.client.dto.FlightSearchRequest;
import com.skyfare.fareservice.comparison.FlightSearchFunction;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Flight offers search and price confirmation.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FlightOffersClient implements FlightSearchFunction {

	private static final String PRICING_TYPE = "flight-offers-pricing";

	private final RequestDispatcher dispatcher;
	private final ObjectMapper objectMapper;

	/**
	 * @return the raw {@code {data, dictionaries, meta}} envelope
	 */
	public JsonNode search(FlightSearchRequest request) {
		log.debug("Searching flight offers: {}", request);
		return dispatcher.executeOrThrow(
			ApiRequest.get(AmadeusConstants.FLIGHT_OFFERS_PATH, CallType.SEARCH, request.toQueryParams()));
	}

	@Override
	public FlightOffersResponse searchOffers(FlightSearchRequest request) {
		JsonNode body = search(request);
		try {
			return objectMapper.treeToValue(body, FlightOffersResponse.class);
		} catch (JsonProcessingException e) {
			throw new SerializationException("Failed to read flight offers response", e);
		}
	}

	/**
	 * Confirms the current price of one offer (an object) or several (an array), exactly as
	 * returned by a search.
	 */
	public JsonNode confirmPrice(JsonNode offers) {
		if (offers == null || !(offers.isObject() || offers.isArray())) {
			throw new IllegalArgumentException("Flight offer must be a JSON object or an array of objects");
		}
		if (offers.isArray() && offers.isEmpty()) {
			throw new IllegalArgumentException("At least one flight offer is required");
		}

		ArrayNode flightOffers;
		if (offers.isArray()) {
			flightOffers = (ArrayNode) offers;
		} else {
			flightOffers = objectMapper.createArrayNode().add(offers);
		}

		ObjectNode body = objectMapper.createObjectNode();
		ObjectNode data = body.putObject("data");
		data.put("type", PRICING_TYPE);
		data.set("flightOffers", flightOffers);

		return dispatcher.executeOrThrow(
			ApiRequest.post(AmadeusConstants.FLIGHT_OFFERS_PRICING_PATH, CallType.SEARCH, body));
	}
}
