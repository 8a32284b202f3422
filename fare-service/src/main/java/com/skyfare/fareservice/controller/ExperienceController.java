package com.skyfare.fareservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.CityCoordinates;
import com.skyfare.fareservice.client.ExperiencesClient;
import com.skyfare.fareservice.client.dto.BoundingBox;
import com.skyfare.fareservice.client.dto.GeoPoint;
import com.skyfare.fareservice.client.dto.PoiCategory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Activities and points of interest. A location is given as a city name, a latitude/longitude
 * pair, or a north/south/east/west square, checked in that order.
 */
@RestController
@RequestMapping("/api/experiences")
@Slf4j
@RequiredArgsConstructor
@Validated
@Tag(name = "Experiences", description = "Tours, activities and points of interest around a location")
public class ExperienceController {

	private final ExperiencesClient experiencesClient;

	@GetMapping("/activities")
	@Operation(summary = "Activities around a point or inside a square")
	public ResponseEntity<JsonNode> activities(
		@Parameter(description = "Known city name, e.g. paris")
		@RequestParam(required = false) String city,
		@RequestParam(required = false) @DecimalMin("-90") @DecimalMax("90") Double latitude,
		@RequestParam(required = false) @DecimalMin("-180") @DecimalMax("180") Double longitude,
		@Parameter(description = "Search radius in km")
		@RequestParam(defaultValue = "" + ExperiencesClient.DEFAULT_ACTIVITY_RADIUS_KM) @Min(1) @Max(20) int radius,
		@RequestParam(required = false) Double north,
		@RequestParam(required = false) Double south,
		@RequestParam(required = false) Double east,
		@RequestParam(required = false) Double west) {

		BoundingBox box = boundingBox(north, south, east, west);
		if (box != null && StringUtils.isBlank(city) && latitude == null) {
			return ResponseEntity.ok(experiencesClient.activitiesBySquare(box));
		}
		return ResponseEntity.ok(experiencesClient.activities(resolvePoint(city, latitude, longitude), radius));
	}

	@GetMapping("/activities/{id}")
	@Operation(summary = "One activity by id")
	public ResponseEntity<JsonNode> activity(@PathVariable String id) {
		return ResponseEntity.ok(experiencesClient.activity(id));
	}

	@GetMapping("/points-of-interest")
	@Operation(summary = "Points of interest around a point or inside a square")
	public ResponseEntity<JsonNode> pointsOfInterest(
		@RequestParam(required = false) String city,
		@RequestParam(required = false) @DecimalMin("-90") @DecimalMax("90") Double latitude,
		@RequestParam(required = false) @DecimalMin("-180") @DecimalMax("180") Double longitude,
		@RequestParam(defaultValue = "" + ExperiencesClient.DEFAULT_POI_RADIUS_KM) @Min(1) @Max(20) int radius,
		@Parameter(description = "Comma-separated: SIGHTS, NIGHTLIFE, RESTAURANT, SHOPPING")
		@RequestParam(required = false) String categories,
		@RequestParam(required = false) Double north,
		@RequestParam(required = false) Double south,
		@RequestParam(required = false) Double east,
		@RequestParam(required = false) Double west) {

		List<PoiCategory> parsed = PoiCategory.parseList(categories);
		BoundingBox box = boundingBox(north, south, east, west);
		if (box != null && StringUtils.isBlank(city) && latitude == null) {
			return ResponseEntity.ok(experiencesClient.pointsOfInterestBySquare(box, parsed));
		}
		return ResponseEntity.ok(experiencesClient.pointsOfInterest(resolvePoint(city, latitude, longitude), radius, parsed));
	}

	private GeoPoint resolvePoint(String city, Double latitude, Double longitude) {
		if (StringUtils.isNotBlank(city)) {
			return CityCoordinates.lookup(city)
				.orElseThrow(() -> new IllegalArgumentException("Unknown city '" + city + "'. Use latitude and longitude instead."));
		}
		if (latitude == null || longitude == null) {
			throw new IllegalArgumentException("Provide a city, latitude and longitude, or north, south, east and west");
		}
		return new GeoPoint(latitude, longitude);
	}

	private BoundingBox boundingBox(Double north, Double south, Double east, Double west) {
		if (north == null || south == null || east == null || west == null) {
			return null;
		}
		return new BoundingBox(north, south, east, west);
	}
}
