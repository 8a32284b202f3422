package com.skyfare.fareservice.client.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The parts of the flight-offers envelope the comparison reads. Everything else is ignored.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class FlightOffersResponse {

	@Builder.Default
	private List<FlightOffer> data = new ArrayList<>();

	private Dictionaries dictionaries;

	public String carrierName(String carrierCode) {
		if (dictionaries == null || dictionaries.getCarriers() == null || carrierCode == null) {
			return carrierCode;
		}
		return dictionaries.getCarriers().getOrDefault(carrierCode, carrierCode);
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class Dictionaries {
		private Map<String, String> carriers = new LinkedHashMap<>();
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@Builder
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class FlightOffer {
		private String id;
		private Price price;

		@Builder.Default
		private List<Itinerary> itineraries = new ArrayList<>();
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@Builder
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class Price {
		private String currency;
		private BigDecimal total;
		private BigDecimal grandTotal;
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@Builder
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class Itinerary {
		private String duration;

		@Builder.Default
		private List<Segment> segments = new ArrayList<>();
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	@Builder
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class Segment {
		private String carrierCode;
		private String number;
	}
}
