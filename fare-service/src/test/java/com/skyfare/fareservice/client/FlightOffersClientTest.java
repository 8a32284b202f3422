package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.common.config.SecureObjectMapperConfig;
import com.skyfare.fareservice.client.dto.FlightOffersResponse;
import com.skyfare.fareservice.client.dto.FlightSearchRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpMethod;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FlightOffersClientTest {

	private static final String OFFERS_JSON = """
		{
		  "meta": {"count": 1},
		  "data": [{
		    "type": "flight-offer",
		    "id": "1",
		    "source": "GDS",
		    "itineraries": [{
		      "duration": "PT2H5M",
		      "segments": [
		        {"carrierCode": "IB", "number": "3167", "departure": {"iataCode": "LHR"}},
		        {"carrierCode": "IB", "number": "1234", "departure": {"iataCode": "MAD"}}
		      ]
		    }],
		    "price": {"currency": "GBP", "total": "120.50", "base": "80.00", "grandTotal": "121.00"}
		  }],
		  "dictionaries": {"carriers": {"IB": "IBERIA"}, "aircraft": {"320": "AIRBUS A320"}}
		}
		""";

	@Mock
	private RequestDispatcher dispatcher;

	private ObjectMapper objectMapper;
	private FlightOffersClient client;

	@BeforeEach
	void setUp() {
		objectMapper = new SecureObjectMapperConfig().objectMapper();
		client = new FlightOffersClient(dispatcher, objectMapper);
	}

	@Test
	void search_sendsSearchCallWithMappedParams() {
		when(dispatcher.executeOrThrow(any())).thenReturn(objectMapper.createObjectNode());

		client.search(FlightSearchRequest.builder()
			.origin("lhr")
			.destination("bcn")
			.departureDate(LocalDate.of(2026, 3, 15))
			.build());

		ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
		verify(dispatcher).executeOrThrow(captor.capture());
		ApiRequest request = captor.getValue();
		assertEquals(HttpMethod.GET, request.getMethod());
		assertEquals("/v2/shopping/flight-offers", request.getPath());
		assertEquals(CallType.SEARCH, request.getCallType());
		assertEquals("LHR", request.getParams().get("originLocationCode"));
		assertEquals("BCN", request.getParams().get("destinationLocationCode"));
		assertEquals("2026-03-15", request.getParams().get("departureDate"));
	}

	@Test
	void searchOffers_readsTypedResponseIgnoringUnknownFields() throws Exception {
		when(dispatcher.executeOrThrow(any())).thenReturn(objectMapper.readTree(OFFERS_JSON));

		FlightOffersResponse response = client.searchOffers(FlightSearchRequest.builder()
			.origin("LHR").destination("MAD").departureDate(LocalDate.of(2026, 3, 15)).build());

		assertEquals(1, response.getData().size());
		FlightOffersResponse.FlightOffer offer = response.getData().get(0);
		assertEquals(new BigDecimal("121.00"), offer.getPrice().getGrandTotal());
		assertEquals(2, offer.getItineraries().get(0).getSegments().size());
		assertEquals("IBERIA", response.carrierName("IB"));
		assertEquals("XX", response.carrierName("XX"));
	}

	@Test
	void confirmPrice_whenSingleOffer_thenWrapsInArray() throws Exception {
		when(dispatcher.executeOrThrow(any())).thenReturn(objectMapper.createObjectNode());
		JsonNode offer = objectMapper.readTree(OFFERS_JSON).path("data").get(0);

		client.confirmPrice(offer);

		ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
		verify(dispatcher).executeOrThrow(captor.capture());
		ApiRequest request = captor.getValue();
		assertEquals(HttpMethod.POST, request.getMethod());
		assertEquals("/v1/shopping/flight-offers/pricing", request.getPath());
		JsonNode data = request.getBody().path("data");
		assertEquals("flight-offers-pricing", data.path("type").asText());
		assertTrue(data.path("flightOffers").isArray());
		assertEquals(1, data.path("flightOffers").size());
		assertEquals("1", data.path("flightOffers").get(0).path("id").asText());
	}

	@Test
	void confirmPrice_whenArray_thenSendsAsIs() throws Exception {
		when(dispatcher.executeOrThrow(any())).thenReturn(objectMapper.createObjectNode());
		JsonNode offers = objectMapper.readTree(OFFERS_JSON).path("data");

		client.confirmPrice(offers);

		ArgumentCaptor<ApiRequest> captor = ArgumentCaptor.forClass(ApiRequest.class);
		verify(dispatcher).executeOrThrow(captor.capture());
		assertEquals(offers, captor.getValue().getBody().path("data").path("flightOffers"));
	}

	@Test
	void confirmPrice_whenNotObjectOrArray_thenRejected() {
		assertThrows(IllegalArgumentException.class, () -> client.confirmPrice(objectMapper.getNodeFactory().textNode("x")));
		assertThrows(IllegalArgumentException.class, () -> client.confirmPrice(objectMapper.createArrayNode()));
		verifyNoInteractions(dispatcher);
	}
}
