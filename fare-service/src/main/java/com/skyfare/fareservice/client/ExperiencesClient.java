package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.dto.BoundingBox;
import com.skyfare.fareservice.client.dto.GeoPoint;
import com.skyfare.fareservice.client.dto.PoiCategory;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Tours and activities, points of interest.
 */
@Component
@RequiredArgsConstructor
public class ExperiencesClient {

	public static final int DEFAULT_ACTIVITY_RADIUS_KM = 5;
	public static final int DEFAULT_POI_RADIUS_KM = 2;
	public static final int MAX_POI_RADIUS_KM = 20;

	private final RequestDispatcher dispatcher;

	public JsonNode activities(GeoPoint point, int radiusKm) {
		return get(AmadeusConstants.ACTIVITIES_PATH, around(point, radiusKm));
	}

	public JsonNode activitiesBySquare(BoundingBox box) {
		return get(AmadeusConstants.ACTIVITIES_BY_SQUARE_PATH, box.toQueryParams());
	}

	public JsonNode activity(String activityId) {
		if (StringUtils.isBlank(activityId)) {
			throw new IllegalArgumentException("activityId is required");
		}
		String path = AmadeusConstants.ACTIVITIES_PATH + "/" + UriUtils.encodePathSegment(activityId, StandardCharsets.UTF_8);
		return get(path, Map.of());
	}

	public JsonNode pointsOfInterest(GeoPoint point, int radiusKm, Collection<PoiCategory> categories) {
		Map<String, String> params = around(point, Math.min(radiusKm, MAX_POI_RADIUS_KM));
		addCategories(params, categories);
		return get(AmadeusConstants.POIS_PATH, params);
	}

	public JsonNode pointsOfInterestBySquare(BoundingBox box, Collection<PoiCategory> categories) {
		Map<String, String> params = box.toQueryParams();
		addCategories(params, categories);
		return get(AmadeusConstants.POIS_BY_SQUARE_PATH, params);
	}

	private Map<String, String> around(GeoPoint point, int radiusKm) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("latitude", String.valueOf(point.latitude()));
		params.put("longitude", String.valueOf(point.longitude()));
		params.put("radius", String.valueOf(radiusKm));
		return params;
	}

	private void addCategories(Map<String, String> params, Collection<PoiCategory> categories) {
		if (categories != null && !categories.isEmpty()) {
			params.put("categories", categories.stream().map(Enum::name).collect(Collectors.joining(",")));
		}
	}

	private JsonNode get(String path, Map<String, String> params) {
		return dispatcher.executeOrThrow(ApiRequest.get(path, CallType.METADATA, params));
	}
}
