package com.skyfare.fareservice.comparison;

import com.skyfare.fareservice.client.dto.FlightSearchRequest;
import com.skyfare.fareservice.client.dto.TravelClass;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.LocalDate;
import java.util.List;

/**
 * A route, the dates to price it on, and the search options shared by every date.
 */
@Getter
@Builder
@ToString
public class ComparisonRequest {

	private final String origin;
	private final String destination;

	@Singular
	private final List<LocalDate> dates;

	/** round trip when set: each return date is the departure date plus this many days */
	private final Integer returnAfterDays;

	@Builder.Default
	private final int adults = 1;

	@Builder.Default
	private final int children = 0;

	@Builder.Default
	private final int infants = 0;

	private final TravelClass travelClass;
	private final boolean nonStop;
	private final Integer maxPrice;

	@Builder.Default
	private final String currency = AmadeusConstants.DEFAULT_CURRENCY;

	List<DateQuery> toDateQueries() {
		return dates.stream().map(d -> DateQuery.of(d, returnAfterDays)).toList();
	}

	FlightSearchRequest toSearchRequest(DateQuery query, int maxResults) {
		return FlightSearchRequest.builder()
			.origin(origin)
			.destination(destination)
			.departureDate(query.departureDate())
			.returnDate(query.returnDate())
			.adults(adults)
			.children(children)
			.infants(infants)
			.travelClass(travelClass)
			.nonStop(nonStop)
			.maxPrice(maxPrice)
			.currency(currency)
			.maxResults(maxResults)
			.build();
	}
}
