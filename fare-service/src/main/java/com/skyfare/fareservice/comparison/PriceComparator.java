package com.skyfare.fareservice.comparison;

import com.skyfare.common.util.SensitiveDataFilter;
import com.skyfare.fareservice.client.dto.FlightOffersResponse;
import com.skyfare.fareservice.client.dto.FlightSearchRequest;
import com.skyfare.fareservice.config.ComparisonProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Prices a route on a list of dates and ranks the dates cheapest first.
 *
 * <p>Dates are searched independently on a bounded pool. A failed or empty search becomes an
 * unpriced entry carrying the reason; it never fails the batch.
 */
@Service
@Slf4j
public class PriceComparator {

	static final String NO_FLIGHTS_FOUND = "No flights found";
	static final String NO_PRICE = "Offer has no price";

	private static final Comparator<ComparisonEntry> BY_PRICE =
		Comparator.comparing(ComparisonEntry::getPrice, Comparator.nullsLast(Comparator.naturalOrder()));

	private final ExecutorService executor;
	private final ComparisonProperties properties;

	public PriceComparator(@Qualifier("comparisonExecutor") ExecutorService executor, ComparisonProperties properties) {
		this.executor = executor;
		this.properties = properties;
	}

	public ComparisonResult compare(ComparisonRequest request, FlightSearchFunction searchFn) {
		List<DateQuery> queries = request.toDateQueries();
		int total = queries.size();

		if (total == 0) {
			throw new IllegalArgumentException("No dates to compare");
		}
		if (total > properties.getMaxDates()) {
			throw new IllegalArgumentException(String.format(
				"Too many dates to compare: %d (maximum %d)", total, properties.getMaxDates()));
		}
		if (total > properties.getLargeBatchThreshold()) {
			log.warn("Comparing {} dates for {}-{}; this may take a while and use a lot of API quota",
				total, request.getOrigin(), request.getDestination());
		}

		List<CompletableFuture<ComparisonEntry>> futures = new ArrayList<>(total);
		for (int i = 0; i < total; i++) {
			DateQuery query = queries.get(i);
			int position = i + 1;
			futures.add(CompletableFuture.supplyAsync(
				() -> priceDate(request, query, searchFn, position, total), executor));
		}

		List<ComparisonEntry> entries = new ArrayList<>(total);
		for (CompletableFuture<ComparisonEntry> future : futures) {
			entries.add(future.join());
		}

		// List.sort is stable: equal prices keep input order
		entries.sort(BY_PRICE);

		ComparisonEntry first = entries.get(0);
		ComparisonEntry cheapest = first.hasPrice() ? first : null;

		long priced = entries.stream().filter(ComparisonEntry::hasPrice).count();
		log.info("Compared {} dates for {}-{}: {} priced, cheapest {}",
			total, request.getOrigin(), request.getDestination(), priced,
			cheapest != null ? cheapest.getDepartureDate() + " " + cheapest.getPrice() + " " + cheapest.getCurrency() : "none");

		return ComparisonResult.builder()
			.origin(request.getOrigin())
			.destination(request.getDestination())
			.comparison(List.copyOf(entries))
			.cheapest(cheapest)
			.build();
	}

	private ComparisonEntry priceDate(ComparisonRequest request, DateQuery query, FlightSearchFunction searchFn,
									  int position, int total) {
		log.info("[{}/{}] Checking {}", position, total, query.departureDate());

		ComparisonEntry.ComparisonEntryBuilder entry = ComparisonEntry.builder()
			.departureDate(query.departureDate())
			.returnDate(query.returnDate())
			.currency(request.getCurrency());

		FlightSearchRequest searchRequest = request.toSearchRequest(query, properties.getOffersPerDate());
		FlightOffersResponse response;
		try {
			response = searchFn.searchOffers(searchRequest);
		} catch (RuntimeException e) {
			String reason = StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName());
			log.warn("[{}/{}] Search failed for {}: {}", position, total, query.departureDate(),
				SensitiveDataFilter.maskSensitiveData(reason));
			return entry.offersFound(0).error(reason).build();
		}

		List<FlightOffersResponse.FlightOffer> offers = response != null ? response.getData() : null;
		if (offers == null || offers.isEmpty()) {
			return entry.offersFound(0).error(NO_FLIGHTS_FOUND).build();
		}

		FlightOffersResponse.FlightOffer offer = offers.get(0);
		entry.offersFound(offers.size());

		FlightOffersResponse.Price price = offer.getPrice();
		BigDecimal amount = null;
		if (price != null) {
			amount = price.getGrandTotal() != null ? price.getGrandTotal() : price.getTotal();
			if (StringUtils.isNotBlank(price.getCurrency())) {
				entry.currency(price.getCurrency());
			}
		}
		if (amount == null) {
			log.warn("[{}/{}] First offer for {} carries no price", position, total, query.departureDate());
			entry.error(NO_PRICE);
		} else {
			entry.price(amount);
		}

		List<FlightOffersResponse.Segment> outbound = outboundSegments(offer);
		if (!outbound.isEmpty()) {
			String carrierCode = outbound.get(0).getCarrierCode();
			entry.stops(outbound.size() - 1)
				.carrierCode(carrierCode)
				.carrier(response.carrierName(carrierCode));
		}

		return entry.build();
	}

	private List<FlightOffersResponse.Segment> outboundSegments(FlightOffersResponse.FlightOffer offer) {
		if (offer.getItineraries() == null || offer.getItineraries().isEmpty()) {
			return List.of();
		}
		List<FlightOffersResponse.Segment> segments = offer.getItineraries().get(0).getSegments();
		return segments != null ? segments : List.of();
	}
}
