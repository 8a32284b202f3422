package com.skyfare.fareservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.ReferenceDataClient;
import com.skyfare.fareservice.client.dto.LocationSubType;
import com.skyfare.fareservice.constants.AmadeusConstants;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/reference")
@Slf4j
@RequiredArgsConstructor
@Validated
@Tag(name = "Reference data", description = "Airports, cities, airlines and route networks")
public class ReferenceDataController {

	private static final String AIRLINE_CODE = "^[A-Za-z0-9]{2,3}$";

	private final ReferenceDataClient referenceDataClient;

	@GetMapping("/locations")
	@Operation(summary = "Find airports and cities by keyword")
	public ResponseEntity<JsonNode> locations(
		@Parameter(description = "Name or code fragment", example = "lon", required = true)
		@RequestParam @NotBlank @Size(max = 50) String keyword,
		@Parameter(description = "airport, city or both")
		@RequestParam(required = false, defaultValue = "both") String subType) {

		return ResponseEntity.ok(referenceDataClient.locations(keyword, LocationSubType.fromValue(subType)));
	}

	@GetMapping("/airlines")
	@Operation(summary = "Look up airlines by code")
	public ResponseEntity<JsonNode> airlines(
		@Parameter(description = "Comma-separated airline codes", example = "BA,IB", required = true)
		@RequestParam @NotBlank @Pattern(regexp = "^[A-Za-z0-9]{2,3}(,[A-Za-z0-9]{2,3})*$") String codes) {

		return ResponseEntity.ok(referenceDataClient.airlines(codes));
	}

	@GetMapping("/airports/{code}/routes")
	@Operation(summary = "Direct destinations from an airport")
	public ResponseEntity<JsonNode> airportRoutes(
		@PathVariable @Pattern(regexp = "^[A-Za-z]{3}$") String code,
		@RequestParam(defaultValue = "100") @Min(1) @Max(500) int max) {

		return ResponseEntity.ok(referenceDataClient.airportRoutes(code, max));
	}

	@GetMapping("/airlines/{code}/routes")
	@Operation(summary = "Destinations served by an airline")
	public ResponseEntity<JsonNode> airlineRoutes(
		@PathVariable @Pattern(regexp = AIRLINE_CODE) String code,
		@RequestParam(defaultValue = "100") @Min(1) @Max(500) int max) {

		return ResponseEntity.ok(referenceDataClient.airlineRoutes(code, max));
	}

	@GetMapping("/airlines/{code}/checkin-links")
	@Operation(summary = "Online check-in links of an airline")
	public ResponseEntity<JsonNode> checkinLinks(
		@PathVariable @Pattern(regexp = AIRLINE_CODE) String code,
		@RequestParam(defaultValue = AmadeusConstants.DEFAULT_CHECKIN_LANGUAGE) String language) {

		return ResponseEntity.ok(referenceDataClient.checkinLinks(code, language));
	}
}
