package com.skyfare.fareservice.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.skyfare.fareservice.client.FlightInspirationClient;
import com.skyfare.fareservice.client.FlightOffersClient;
import com.skyfare.fareservice.client.ReferenceDataClient;
import com.skyfare.fareservice.client.dto.DelayPredictionRequest;
import com.skyfare.fareservice.client.dto.FlightDatesRequest;
import com.skyfare.fareservice.client.dto.FlightSearchRequest;
import com.skyfare.fareservice.client.dto.TravelClass;
import com.skyfare.fareservice.comparison.ComparisonRequest;
import com.skyfare.fareservice.comparison.ComparisonResult;
import com.skyfare.fareservice.comparison.DateFilter;
import com.skyfare.fareservice.comparison.DateRangeGenerator;
import com.skyfare.fareservice.comparison.PriceComparator;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/flights")
@Slf4j
@RequiredArgsConstructor
@Validated
@Tag(name = "Flights", description = "Flight offer search, price confirmation, cheapest dates and date-by-date price comparison")
public class FlightController {

	private static final String IATA_CODE = "^[A-Za-z]{3}$";

	private final FlightOffersClient flightOffersClient;
	private final FlightInspirationClient flightInspirationClient;
	private final ReferenceDataClient referenceDataClient;
	private final PriceComparator priceComparator;

	@GetMapping("/offers")
	@Operation(
		summary = "Search flight offers",
		description = "Returns the upstream flight-offers envelope (data, dictionaries, meta) unchanged."
	)
	@ApiResponses(value = {
		@ApiResponse(responseCode = "200", description = "Offers found"),
		@ApiResponse(responseCode = "400", description = "Invalid parameters or rejected by the upstream API"),
		@ApiResponse(responseCode = "429", description = "Upstream rate limit still hit after retries"),
		@ApiResponse(responseCode = "502", description = "Upstream authentication or server error")
	})
	public ResponseEntity<JsonNode> searchOffers(
		@Parameter(description = "Origin IATA code", example = "LHR", required = true)
		@RequestParam @Pattern(regexp = IATA_CODE, message = "origin must be a 3-letter IATA code") String origin,
		@Parameter(description = "Destination IATA code", example = "BCN", required = true)
		@RequestParam @Pattern(regexp = IATA_CODE, message = "destination must be a 3-letter IATA code") String destination,
		@Parameter(description = "Departure date (YYYY-MM-DD)", example = "2026-03-15", required = true)
		@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate,
		@Parameter(description = "Return date for a round trip")
		@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate returnDate,
		@RequestParam(defaultValue = "1") @Min(1) @Max(9) int adults,
		@RequestParam(defaultValue = "0") @Min(0) @Max(9) int children,
		@RequestParam(defaultValue = "0") @Min(0) @Max(9) int infants,
		@RequestParam(required = false) TravelClass travelClass,
		@RequestParam(defaultValue = "false") boolean nonStop,
		@Parameter(description = "Maximum number of offers, capped at 250")
		@RequestParam(defaultValue = "20") @Min(1) int max,
		@RequestParam(required = false) @Min(1) Integer maxPrice,
		@RequestParam(defaultValue = "GBP") @Pattern(regexp = "^[A-Za-z]{3}$") String currency) {

		FlightSearchRequest request = FlightSearchRequest.builder()
			.origin(origin)
			.destination(destination)
			.departureDate(departureDate)
			.returnDate(returnDate)
			.adults(adults)
			.children(children)
			.infants(infants)
			.travelClass(travelClass)
			.nonStop(nonStop)
			.maxResults(max)
			.maxPrice(maxPrice)
			.currency(currency.toUpperCase())
			.build();

		return ResponseEntity.ok(flightOffersClient.search(request));
	}

	@PostMapping("/offers/pricing")
	@Operation(
		summary = "Confirm the price of flight offers",
		description = "Body is one offer object or an array of offers, exactly as returned by the search."
	)
	public ResponseEntity<JsonNode> confirmPrice(@RequestBody JsonNode offers) {
		return ResponseEntity.ok(flightOffersClient.confirmPrice(offers));
	}

	@GetMapping("/cheapest-dates")
	@Operation(summary = "Cheapest travel dates on a route", description = "Served from the upstream fare cache, not live prices.")
	public ResponseEntity<JsonNode> cheapestDates(
		@RequestParam @Pattern(regexp = IATA_CODE) String origin,
		@RequestParam @Pattern(regexp = IATA_CODE) String destination,
		@Parameter(description = "A date or a 'from,to' range")
		@RequestParam(required = false) String departureDate,
		@RequestParam(required = false) Boolean oneWay,
		@Parameter(description = "Trip length in days")
		@RequestParam(required = false) @Min(1) Integer duration,
		@RequestParam(defaultValue = "false") boolean nonStop,
		@RequestParam(required = false) @Min(1) Integer maxPrice,
		@Parameter(description = "DATE, DURATION, WEEK")
		@RequestParam(required = false) String viewBy,
		@RequestParam(defaultValue = "GBP") String currency) {

		FlightDatesRequest request = datesRequest(origin, destination, departureDate, oneWay, duration, nonStop, maxPrice, viewBy, currency);
		return ResponseEntity.ok(flightInspirationClient.cheapestDates(request));
	}

	@GetMapping("/destinations")
	@Operation(summary = "Cheapest destinations from an origin")
	public ResponseEntity<JsonNode> destinations(
		@RequestParam @Pattern(regexp = IATA_CODE) String origin,
		@RequestParam(required = false) String departureDate,
		@RequestParam(required = false) Boolean oneWay,
		@RequestParam(required = false) @Min(1) Integer duration,
		@RequestParam(defaultValue = "false") boolean nonStop,
		@RequestParam(required = false) @Min(1) Integer maxPrice,
		@RequestParam(required = false) String viewBy,
		@RequestParam(defaultValue = "GBP") String currency) {

		FlightDatesRequest request = datesRequest(origin, null, departureDate, oneWay, duration, nonStop, maxPrice, viewBy, currency);
		return ResponseEntity.ok(flightInspirationClient.destinations(request));
	}

	@GetMapping("/comparison")
	@RateLimiter(name = "flightComparison", fallbackMethod = "compareRateLimitFallback")
	@Operation(
		summary = "Compare prices across dates",
		description = "Searches each date separately and ranks the dates cheapest first. " +
			"Give either an explicit comma-separated list of dates or a start and end date, not both. " +
			"The weekend and weekday filters only apply to a start and end range. " +
			"Dates whose search fails or finds nothing are listed last with the reason. " +
			"Every date costs one upstream search, so this endpoint is rate limited."
	)
	@ApiResponses(value = {
		@ApiResponse(
			responseCode = "200",
			description = "Ranked comparison",
			content = @Content(schema = @Schema(implementation = ComparisonResult.class))
		),
		@ApiResponse(responseCode = "400", description = "No dates, both filters set, or invalid parameters"),
		@ApiResponse(responseCode = "429", description = "Comparison rate limit exceeded")
	})
	public ResponseEntity<ComparisonResult> compare(
		@RequestParam @Pattern(regexp = IATA_CODE) String origin,
		@RequestParam @Pattern(regexp = IATA_CODE) String destination,
		@Parameter(description = "Comma-separated dates, e.g. 2026-03-01,2026-03-08")
		@RequestParam(required = false) String dates,
		@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
		@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
		@RequestParam(defaultValue = "false") boolean weekendsOnly,
		@RequestParam(defaultValue = "false") boolean weekdaysOnly,
		@Parameter(description = "Round trip: return this many days after each departure. 0 or absent means one-way")
		@RequestParam(required = false) @Min(0) Integer returnAfterDays,
		@RequestParam(defaultValue = "1") @Min(1) @Max(9) int adults,
		@RequestParam(defaultValue = "0") @Min(0) @Max(9) int children,
		@RequestParam(defaultValue = "0") @Min(0) @Max(9) int infants,
		@RequestParam(required = false) TravelClass travelClass,
		@RequestParam(defaultValue = "false") boolean nonStop,
		@RequestParam(required = false) @Min(1) Integer maxPrice,
		@RequestParam(defaultValue = "GBP") String currency) {

		List<LocalDate> departureDates = resolveDates(dates, start, end, DateFilter.of(weekendsOnly, weekdaysOnly));

		ComparisonRequest request = ComparisonRequest.builder()
			.origin(origin.toUpperCase())
			.destination(destination.toUpperCase())
			.dates(departureDates)
			.returnAfterDays(returnAfterDays)
			.adults(adults)
			.children(children)
			.infants(infants)
			.travelClass(travelClass)
			.nonStop(nonStop)
			.maxPrice(maxPrice)
			.currency(currency.toUpperCase())
			.build();

		log.debug("Comparing {} dates for {}-{}", departureDates.size(), request.getOrigin(), request.getDestination());
		return ResponseEntity.ok(priceComparator.compare(request, flightOffersClient));
	}

	@GetMapping("/delay-prediction")
	@Operation(summary = "Predict the delay of a scheduled flight")
	public ResponseEntity<JsonNode> delayPrediction(
		@RequestParam @Pattern(regexp = IATA_CODE) String origin,
		@RequestParam @Pattern(regexp = IATA_CODE) String destination,
		@RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate departureDate,
		@Parameter(description = "Local departure time (HH:MM:SS)", example = "18:20:00")
		@RequestParam @Pattern(regexp = "^\\d{2}:\\d{2}:\\d{2}$") String departureTime,
		@RequestParam @Pattern(regexp = "^[A-Za-z0-9]{2}$") String carrierCode,
		@RequestParam String flightNumber,
		@RequestParam(required = false) String aircraftCode,
		@Parameter(description = "Flight duration in minutes")
		@RequestParam(required = false) @Min(1) Integer duration) {

		DelayPredictionRequest request = DelayPredictionRequest.builder()
			.origin(origin)
			.destination(destination)
			.departureDate(departureDate.toString())
			.departureTime(departureTime)
			.carrierCode(carrierCode)
			.flightNumber(flightNumber)
			.aircraftCode(aircraftCode)
			.durationMinutes(duration)
			.build();

		return ResponseEntity.ok(referenceDataClient.delayPrediction(request));
	}

	/**
	 * An explicit list is searched as given; the weekday filters only narrow a start/end range.
	 */
	private List<LocalDate> resolveDates(String dates, LocalDate start, LocalDate end, DateFilter filter) {
		if (StringUtils.isNotBlank(dates)) {
			if (start != null || end != null) {
				throw new IllegalArgumentException("Provide either dates or start and end, not both");
			}
			return DateRangeGenerator.parseDates(dates);
		}
		if (start == null || end == null) {
			throw new IllegalArgumentException("Provide either dates or both start and end");
		}
		return DateRangeGenerator.generate(start, end, filter);
	}

	private FlightDatesRequest datesRequest(String origin, String destination, String departureDate, Boolean oneWay,
											Integer duration, boolean nonStop, Integer maxPrice, String viewBy, String currency) {
		return FlightDatesRequest.builder()
			.origin(origin)
			.destination(destination)
			.departureDate(departureDate)
			.oneWay(oneWay)
			.duration(duration)
			.nonStop(nonStop)
			.maxPrice(maxPrice)
			.viewBy(viewBy)
			.currency(currency.toUpperCase())
			.build();
	}

	/**
	 * Fallback method for rate limit exceeded on the comparison endpoint.
	 */
	@SuppressWarnings("unused")
	private ResponseEntity<ComparisonResult> compareRateLimitFallback(
			String origin, String destination, String dates, LocalDate start, LocalDate end,
			boolean weekendsOnly, boolean weekdaysOnly, Integer returnAfterDays,
			int adults, int children, int infants, TravelClass travelClass,
			boolean nonStop, Integer maxPrice, String currency, RequestNotPermitted e) {
		log.warn("Rate limit exceeded for comparison. route={}-{}", origin, destination);
		return ResponseEntity.status(429).build();
	}
}
