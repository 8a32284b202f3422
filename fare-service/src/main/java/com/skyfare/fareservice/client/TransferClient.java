package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.fareservice.client.dto.TransferSearchRequest;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class TransferClient {

	private final RequestDispatcher dispatcher;
	private final ObjectMapper objectMapper;

	/**
	 * Searches transfer offers. Location and country codes are upper-cased; a pickup and a
	 * drop-off must each be given by code, address or geo code.
	 */
	public JsonNode search(TransferSearchRequest request) {
		if (!hasStart(request) || !hasEnd(request)) {
			throw new IllegalArgumentException("Both a pickup and a drop-off location are required");
		}

		TransferSearchRequest normalized = request.toBuilder()
			.startLocationCode(upper(request.getStartLocationCode()))
			.startCountryCode(upper(request.getStartCountryCode()))
			.endLocationCode(upper(request.getEndLocationCode()))
			.endCountryCode(upper(request.getEndCountryCode()))
			.build();

		JsonNode body = objectMapper.valueToTree(normalized);
		return dispatcher.executeOrThrow(ApiRequest.post(AmadeusConstants.TRANSFER_OFFERS_PATH, CallType.SEARCH, body));
	}

	private boolean hasStart(TransferSearchRequest r) {
		return StringUtils.isNotBlank(r.getStartLocationCode())
			|| StringUtils.isNotBlank(r.getStartAddressLine())
			|| StringUtils.isNotBlank(r.getStartGeoCode());
	}

	private boolean hasEnd(TransferSearchRequest r) {
		return StringUtils.isNotBlank(r.getEndLocationCode())
			|| StringUtils.isNotBlank(r.getEndAddressLine())
			|| StringUtils.isNotBlank(r.getEndGeoCode());
	}

	private String upper(String value) {
		return value != null ? value.toUpperCase(Locale.ROOT) : null;
	}
}
