package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.springframework.http.HttpMethod;

import java.util.Map;

/**
 * One call against the travel API, relative to the configured base URL.
 * Query parameters keep insertion order.
 */
@Getter
@Builder
public class ApiRequest {

	@Builder.Default
	private final HttpMethod method = HttpMethod.GET;

	private final String path;

	@Singular
	private final Map<String, String> params;

	private final JsonNode body;

	@Builder.Default
	private final CallType callType = CallType.METADATA;

	public static ApiRequest get(String path, CallType callType, Map<String, String> params) {
		return ApiRequest.builder()
			.method(HttpMethod.GET)
			.path(path)
			.params(params)
			.callType(callType)
			.build();
	}

	public static ApiRequest post(String path, CallType callType, JsonNode body) {
		return ApiRequest.builder()
			.method(HttpMethod.POST)
			.path(path)
			.body(body)
			.callType(callType)
			.build();
	}

	public String describe() {
		return method.name() + " " + path;
	}
}
