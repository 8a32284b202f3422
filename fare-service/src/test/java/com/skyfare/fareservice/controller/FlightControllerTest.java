package com.skyfare.fareservice.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.common.config.SecureObjectMapperConfig;
import com.skyfare.common.exception.ClientErrorException;
import com.skyfare.common.exception.GlobalExceptionHandler;
import com.skyfare.common.exception.RetriesExhaustedException;
import com.skyfare.fareservice.client.FlightInspirationClient;
import com.skyfare.fareservice.client.FlightOffersClient;
import com.skyfare.fareservice.client.ReferenceDataClient;
import com.skyfare.fareservice.client.dto.FlightDatesRequest;
import com.skyfare.fareservice.client.dto.FlightSearchRequest;
import com.skyfare.fareservice.client.dto.TravelClass;
import com.skyfare.fareservice.comparison.ComparisonEntry;
import com.skyfare.fareservice.comparison.ComparisonRequest;
import com.skyfare.fareservice.comparison.ComparisonResult;
import com.skyfare.fareservice.comparison.PriceComparator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class FlightControllerTest {
	
	private MockMvc mockMvc;
	private ObjectMapper objectMapper;
	
	@Mock
	private FlightOffersClient flightOffersClient;
	
	@Mock
	private FlightInspirationClient flightInspirationClient;
	
	@Mock
	private ReferenceDataClient referenceDataClient;
	
	@Mock
	private PriceComparator priceComparator;
	
	@InjectMocks
	private FlightController flightController;
	
	@BeforeEach
	void setUp() {
		objectMapper = new SecureObjectMapperConfig().objectMapper();
		mockMvc = MockMvcBuilders.standaloneSetup(flightController)
			.setControllerAdvice(new GlobalExceptionHandler())
			.setMessageConverters(new MappingJackson2HttpMessageConverter(objectMapper))
			.build();
	}
	
	@Test
	void testSearchOffers_Success_ReturnsUpstreamEnvelope() throws Exception {
		when(flightOffersClient.search(any(FlightSearchRequest.class)))
			.thenReturn(objectMapper.readTree("{\"data\":[{\"id\":\"1\"}],\"meta\":{\"count\":1}}"));
		
		mockMvc.perform(get("/api/flights/offers")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("departureDate", "2026-03-15")
				.param("travelClass", "ECONOMY")
				.param("nonStop", "true"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.data[0].id").value("1"))
			.andExpect(jsonPath("$.meta.count").value(1));
		
		ArgumentCaptor<FlightSearchRequest> captor = ArgumentCaptor.forClass(FlightSearchRequest.class);
		verify(flightOffersClient).search(captor.capture());
		assertEquals(LocalDate.of(2026, 3, 15), captor.getValue().getDepartureDate());
		assertEquals(TravelClass.ECONOMY, captor.getValue().getTravelClass());
		assertTrue(captor.getValue().isNonStop());
		assertEquals(1, captor.getValue().getAdults());
		assertEquals(20, captor.getValue().getMaxResults());
	}
	
	@Test
	void testSearchOffers_MissingDepartureDate_ReturnsBadRequest() throws Exception {
		mockMvc.perform(get("/api/flights/offers")
				.param("origin", "LHR")
				.param("destination", "BCN"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"));
		
		verifyNoInteractions(flightOffersClient);
	}
	
	@Test
	void testSearchOffers_UpstreamRejects_ReturnsBadRequestWithDetail() throws Exception {
		when(flightOffersClient.search(any(FlightSearchRequest.class)))
			.thenThrow(new ClientErrorException("departureDate must be in the future"));
		
		mockMvc.perform(get("/api/flights/offers")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("departureDate", "2020-01-01"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("UPSTREAM_BAD_REQUEST"))
			.andExpect(jsonPath("$.message").value("Bad request: departureDate must be in the future"));
	}
	
	@Test
	void testSearchOffers_RetriesExhausted_ReturnsTooManyRequests() throws Exception {
		when(flightOffersClient.search(any(FlightSearchRequest.class))).thenThrow(new RetriesExhaustedException(3));
		
		mockMvc.perform(get("/api/flights/offers")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("departureDate", "2026-03-15"))
			.andExpect(status().isTooManyRequests())
			.andExpect(jsonPath("$.errorCode").value("RATE_LIMIT_EXCEEDED"));
	}
	
	@Test
	void testConfirmPrice_PassesBodyThrough() throws Exception {
		when(flightOffersClient.confirmPrice(any())).thenReturn(objectMapper.readTree("{\"data\":{\"type\":\"flight-offers-pricing\"}}"));
		
		mockMvc.perform(post("/api/flights/offers/pricing")
				.contentType(MediaType.APPLICATION_JSON)
				.content("{\"type\":\"flight-offer\",\"id\":\"1\"}"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.data.type").value("flight-offers-pricing"));
		
		verify(flightOffersClient).confirmPrice(objectMapper.readTree("{\"type\":\"flight-offer\",\"id\":\"1\"}"));
	}
	
	@Test
	void testCheapestDates_MapsParams() throws Exception {
		when(flightInspirationClient.cheapestDates(any())).thenReturn(objectMapper.createObjectNode());
		
		mockMvc.perform(get("/api/flights/cheapest-dates")
				.param("origin", "MAD")
				.param("destination", "MUC")
				.param("oneWay", "true"))
			.andExpect(status().isOk());
		
		ArgumentCaptor<FlightDatesRequest> captor = ArgumentCaptor.forClass(FlightDatesRequest.class);
		verify(flightInspirationClient).cheapestDates(captor.capture());
		assertEquals("MAD", captor.getValue().getOrigin());
		assertEquals("MUC", captor.getValue().getDestination());
		assertEquals(Boolean.TRUE, captor.getValue().getOneWay());
		assertEquals("GBP", captor.getValue().getCurrency());
	}
	
	@Test
	void testCompare_WithRange_ReturnsRankedComparison() throws Exception {
		ComparisonEntry cheapest = ComparisonEntry.builder()
			.departureDate(LocalDate.of(2026, 3, 7))
			.price(new BigDecimal("95.00"))
			.currency("GBP")
			.stops(0)
			.carrier("VUELING AIRLINES")
			.carrierCode("VY")
			.offersFound(5)
			.build();
		ComparisonEntry unpriced = ComparisonEntry.builder()
			.departureDate(LocalDate.of(2026, 3, 1))
			.currency("GBP")
			.error("No flights found")
			.build();
		when(priceComparator.compare(any(ComparisonRequest.class), eq(flightOffersClient)))
			.thenReturn(ComparisonResult.builder()
				.origin("LHR")
				.destination("BCN")
				.comparison(List.of(cheapest, unpriced))
				.cheapest(cheapest)
				.build());
		
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "lhr")
				.param("destination", "bcn")
				.param("start", "2026-03-01")
				.param("end", "2026-03-07")
				.param("weekendsOnly", "true"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.comparison[0].departureDate").value("2026-03-07"))
			.andExpect(jsonPath("$.comparison[0].price").value(95.00))
			.andExpect(jsonPath("$.comparison[1].error").value("No flights found"))
			.andExpect(jsonPath("$.cheapest.carrierCode").value("VY"));
		
		ArgumentCaptor<ComparisonRequest> captor = ArgumentCaptor.forClass(ComparisonRequest.class);
		verify(priceComparator).compare(captor.capture(), eq(flightOffersClient));
		assertEquals("LHR", captor.getValue().getOrigin());
		assertEquals(List.of(LocalDate.of(2026, 3, 1), LocalDate.of(2026, 3, 7)), captor.getValue().getDates());
	}
	
	@Test
	void testCompare_WithExplicitDates_KeepsGivenDates() throws Exception {
		when(priceComparator.compare(any(ComparisonRequest.class), eq(flightOffersClient)))
			.thenReturn(ComparisonResult.builder().origin("LHR").destination("BCN").comparison(List.of()).build());
		
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("dates", "2026-03-08,2026-03-01")
				.param("returnAfterDays", "7"))
			.andExpect(status().isOk());
		
		ArgumentCaptor<ComparisonRequest> captor = ArgumentCaptor.forClass(ComparisonRequest.class);
		verify(priceComparator).compare(captor.capture(), eq(flightOffersClient));
		assertEquals(List.of(LocalDate.of(2026, 3, 8), LocalDate.of(2026, 3, 1)), captor.getValue().getDates());
		assertEquals(7, captor.getValue().getReturnAfterDays());
	}
	
	@Test
	void testCompare_ExplicitDatesWithWeekendFilter_SearchesEveryGivenDate() throws Exception {
		when(priceComparator.compare(any(ComparisonRequest.class), eq(flightOffersClient)))
			.thenReturn(ComparisonResult.builder().origin("LHR").destination("BCN").comparison(List.of()).build());
		
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("dates", "2026-03-02,2026-03-03,2026-03-07")
				.param("weekendsOnly", "true"))
			.andExpect(status().isOk());
		
		ArgumentCaptor<ComparisonRequest> captor = ArgumentCaptor.forClass(ComparisonRequest.class);
		verify(priceComparator).compare(captor.capture(), eq(flightOffersClient));
		assertEquals(List.of(LocalDate.of(2026, 3, 2), LocalDate.of(2026, 3, 3), LocalDate.of(2026, 3, 7)),
			captor.getValue().getDates());
	}
	
	@Test
	void testCompare_DatesAndRange_ReturnsBadRequest() throws Exception {
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("dates", "2026-03-02")
				.param("start", "2026-03-01")
				.param("end", "2026-03-07"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"))
			.andExpect(jsonPath("$.message").value("Provide either dates or start and end, not both"));
		
		verifyNoInteractions(priceComparator);
	}
	
	@Test
	void testCompare_DatesAndStartOnly_ReturnsBadRequest() throws Exception {
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("dates", "2026-03-02")
				.param("start", "2026-03-01"))
			.andExpect(status().isBadRequest());
		
		verifyNoInteractions(priceComparator);
	}
	
	@Test
	void testCompare_BothFilters_ReturnsBadRequest() throws Exception {
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "LHR")
				.param("destination", "BCN")
				.param("start", "2026-03-01")
				.param("end", "2026-03-07")
				.param("weekendsOnly", "true")
				.param("weekdaysOnly", "true"))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value("INVALID_ARGUMENT"));
		
		verifyNoInteractions(priceComparator);
	}
	
	@Test
	void testCompare_NoDates_ReturnsBadRequest() throws Exception {
		mockMvc.perform(get("/api/flights/comparison")
				.param("origin", "LHR")
				.param("destination", "BCN"))
			.andExpect(status().isBadRequest());
		
		verifyNoInteractions(priceComparator);
	}
	
	@Test
	void testDelayPrediction_MapsParams() throws Exception {
		when(referenceDataClient.delayPrediction(any())).thenReturn(objectMapper.createObjectNode());
		
		mockMvc.perform(get("/api/flights/delay-prediction")
				.param("origin", "NCE")
				.param("destination", "IST")
				.param("departureDate", "2026-08-01")
				.param("departureTime", "18:20:00")
				.param("carrierCode", "TK")
				.param("flightNumber", "1816")
				.param("duration", "235"))
			.andExpect(status().isOk());
		
		verify(referenceDataClient).delayPrediction(argThat(r -> r.getDurationMinutes() == 235 && "2026-08-01".equals(r.getDepartureDate())));
	}
}
