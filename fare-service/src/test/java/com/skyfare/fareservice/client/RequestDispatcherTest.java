package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.common.config.SecureObjectMapperConfig;
import com.skyfare.common.exception.AuthFailureException;
import com.skyfare.common.exception.ClientErrorException;
import com.skyfare.common.exception.ExternalApiException;
import com.skyfare.common.exception.RetriesExhaustedException;
import com.skyfare.common.exception.UpstreamServiceException;
import com.skyfare.fareservice.auth.TokenManager;
import com.skyfare.fareservice.config.AmadeusProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

@ExtendWith(MockitoExtension.class)
class RequestDispatcherTest {

	private static final String BASE_URL = "https://amadeus.test.local";
	private static final String AIRLINES_URL = BASE_URL + "/v1/reference-data/airlines?airlineCodes=BA";

	@Mock
	private TokenManager tokenManager;

	private MockRestServiceServer server;
	private SimpleMeterRegistry meterRegistry;
	private RequestDispatcher dispatcher;

	@BeforeEach
	void setUp() {
		RestTemplate restTemplate = new RestTemplate();
		server = MockRestServiceServer.bindTo(restTemplate).build();
		meterRegistry = new SimpleMeterRegistry();
		ObjectMapper objectMapper = new SecureObjectMapperConfig().objectMapper();

		AmadeusProperties properties = new AmadeusProperties();
		properties.setBaseUrl(BASE_URL + "/");

		lenient().when(tokenManager.getAccessToken()).thenReturn("test-token");

		dispatcher = new RequestDispatcher(tokenManager, restTemplate, restTemplate, objectMapper,
			new RetryPolicy(3, Duration.ofMillis(10), 2.0), new AmadeusClientMetrics(meterRegistry), properties);
	}

	private static ApiRequest airlines() {
		return ApiRequest.get("/v1/reference-data/airlines", CallType.METADATA, Map.of("airlineCodes", "BA"));
	}

	private double counter(String name) {
		return meterRegistry.counter(name, "client", "amadeus").count();
	}

	@Test
	void execute_whenOk_thenSuccessWithBearerHeader() {
		server.expect(requestTo(AIRLINES_URL))
			.andExpect(method(HttpMethod.GET))
			.andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer test-token"))
			.andRespond(withSuccess("{\"data\":[{\"iataCode\":\"BA\"}]}", MediaType.APPLICATION_JSON));

		RequestOutcome outcome = dispatcher.execute(airlines());

		RequestOutcome.Success success = assertInstanceOf(RequestOutcome.Success.class, outcome);
		assertEquals("BA", success.body().path("data").get(0).path("iataCode").asText());
		server.verify();
	}

	@Test
	void execute_whenOkWithEmptyBody_thenSuccessWithEmptyObject() {
		server.expect(requestTo(AIRLINES_URL)).andRespond(withSuccess());

		RequestOutcome outcome = dispatcher.execute(airlines());

		RequestOutcome.Success success = assertInstanceOf(RequestOutcome.Success.class, outcome);
		assertTrue(success.body().isObject());
		assertTrue(success.body().isEmpty());
	}

	@Test
	void execute_whenRateLimitedEveryTime_thenRetriesExhausted() {
		server.expect(ExpectedCount.times(3), requestTo(AIRLINES_URL))
			.andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

		RetriesExhaustedException ex = assertThrows(RetriesExhaustedException.class, () -> dispatcher.execute(airlines()));

		assertEquals(3, ex.getAttempts());
		assertEquals("Max retries exceeded due to rate limiting (3 attempts)", ex.getMessage());
		assertEquals(3.0, counter("amadeus.rate_limited"));
		assertEquals(3.0, counter("amadeus.requests"));
		server.verify();
	}

	@Test
	void execute_whenRateLimitedThenOk_thenSucceedsOnRetry() {
		server.expect(ExpectedCount.once(), requestTo(AIRLINES_URL))
			.andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).header(HttpHeaders.RETRY_AFTER, "1"));
		server.expect(ExpectedCount.once(), requestTo(AIRLINES_URL))
			.andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

		RequestOutcome outcome = dispatcher.execute(airlines());

		assertTrue(outcome.isSuccess());
		assertEquals(1.0, counter("amadeus.rate_limited"));
		assertEquals(1L, meterRegistry.summary("amadeus.retry_after", "client", "amadeus").count());
		assertEquals(1.0, meterRegistry.summary("amadeus.retry_after", "client", "amadeus").totalAmount());
		server.verify();
	}

	@Test
	void execute_whenRateLimitedWithoutRetryAfter_thenNoHintRecorded() {
		server.expect(ExpectedCount.once(), requestTo(AIRLINES_URL))
			.andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
		server.expect(ExpectedCount.once(), requestTo(AIRLINES_URL))
			.andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

		assertTrue(dispatcher.execute(airlines()).isSuccess());

		assertEquals(1.0, counter("amadeus.rate_limited"));
		assertEquals(0L, meterRegistry.summary("amadeus.retry_after", "client", "amadeus").count());
		server.verify();
	}

	@Test
	void execute_whenUnauthorized_thenAuthFailureWithoutRetry() {
		server.expect(ExpectedCount.once(), requestTo(AIRLINES_URL))
			.andRespond(withStatus(HttpStatus.UNAUTHORIZED));

		RequestOutcome outcome = dispatcher.execute(airlines());

		RequestOutcome.AuthFailure failure = assertInstanceOf(RequestOutcome.AuthFailure.class, outcome);
		assertTrue(failure.detail().contains("AMADEUS_API_KEY"));
		server.verify();
		verify(tokenManager, never()).invalidate();
	}

	@Test
	void execute_whenBadRequestWithErrorEnvelope_thenClientErrorWithFirstDetail() {
		server.expect(requestTo(AIRLINES_URL))
			.andRespond(withBadRequest()
				.contentType(MediaType.APPLICATION_JSON)
				.body("{\"errors\":[{\"status\":400,\"code\":477,\"title\":\"INVALID FORMAT\"," +
					"\"detail\":\"departureDate must be in the future\"},{\"detail\":\"second\"}]}"));

		RequestOutcome outcome = dispatcher.execute(airlines());

		RequestOutcome.ClientError error = assertInstanceOf(RequestOutcome.ClientError.class, outcome);
		assertEquals("departureDate must be in the future", error.detail());
	}

	@Test
	void execute_whenBadRequestWithPlainText_thenClientErrorWithRawBody() {
		server.expect(requestTo(AIRLINES_URL))
			.andRespond(withBadRequest().contentType(MediaType.TEXT_PLAIN).body("invalid query"));

		RequestOutcome outcome = dispatcher.execute(airlines());

		assertEquals(new RequestOutcome.ClientError("invalid query"), outcome);
	}

	@Test
	void execute_whenServerError_thenServerErrorWithoutRetry() {
		server.expect(ExpectedCount.once(), requestTo(AIRLINES_URL))
			.andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE).body("maintenance"));

		RequestOutcome outcome = dispatcher.execute(airlines());

		assertEquals(new RequestOutcome.ServerError(503, "maintenance"), outcome);
		assertEquals(1.0, counter("amadeus.errors"));
		server.verify();
	}

	@Test
	void execute_whenTransportFails_thenNetworkError() {
		server.expect(requestTo(AIRLINES_URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

		RequestOutcome outcome = dispatcher.execute(airlines());

		assertInstanceOf(RequestOutcome.NetworkError.class, outcome);
	}

	@Test
	void execute_whenPost_thenSendsJsonBody() {
		ObjectMapper mapper = new ObjectMapper();
		JsonNode body = mapper.createObjectNode().put("startLocationCode", "CDG");

		server.expect(requestTo(BASE_URL + "/v1/shopping/transfer-offers"))
			.andExpect(method(HttpMethod.POST))
			.andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
			.andExpect(jsonPath("$.startLocationCode").value("CDG"))
			.andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

		RequestOutcome outcome = dispatcher.execute(ApiRequest.post("/v1/shopping/transfer-offers", CallType.SEARCH, body));

		assertTrue(outcome.isSuccess());
		server.verify();
	}

	@Test
	void execute_whenParamsNeedEncoding_thenEncodesQuery() {
		server.expect(requestTo(BASE_URL + "/v1/reference-data/locations?keyword=new%20york&subType=AIRPORT,CITY"))
			.andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

		java.util.LinkedHashMap<String, String> params = new java.util.LinkedHashMap<>();
		params.put("keyword", "new york");
		params.put("subType", "AIRPORT,CITY");
		RequestOutcome outcome = dispatcher.execute(ApiRequest.get("/v1/reference-data/locations", CallType.METADATA, params));

		assertTrue(outcome.isSuccess());
		server.verify();
	}

	@Test
	void executeOrThrow_whenBadRequest_thenClientErrorException() {
		server.expect(requestTo(AIRLINES_URL))
			.andRespond(withBadRequest().contentType(MediaType.APPLICATION_JSON)
				.body("{\"errors\":[{\"detail\":\"Invalid airline code\"}]}"));

		ClientErrorException ex = assertThrows(ClientErrorException.class, () -> dispatcher.executeOrThrow(airlines()));

		assertEquals("Invalid airline code", ex.getDetail());
	}

	@Test
	void executeOrThrow_whenUnauthorized_thenAuthFailureException() {
		server.expect(requestTo(AIRLINES_URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

		assertThrows(AuthFailureException.class, () -> dispatcher.executeOrThrow(airlines()));
	}

	@Test
	void executeOrThrow_whenServerError_thenUpstreamServiceException() {
		server.expect(requestTo(AIRLINES_URL)).andRespond(withServerError().body("boom"));

		UpstreamServiceException ex = assertThrows(UpstreamServiceException.class, () -> dispatcher.executeOrThrow(airlines()));

		assertEquals(500, ex.getStatus());
		assertEquals("boom", ex.getResponseBody());
	}

	@Test
	void executeOrThrow_whenTransportFails_thenExternalApiException() {
		server.expect(requestTo(AIRLINES_URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

		ExternalApiException ex = assertThrows(ExternalApiException.class, () -> dispatcher.executeOrThrow(airlines()));

		assertTrue(ex.getMessage().startsWith("Travel API call failed"));
	}

	@Test
	void extractErrorDetail_whenErrorsEmpty_thenReturnsBody() {
		assertEquals("{\"errors\":[]}", dispatcher.extractErrorDetail("{\"errors\":[]}"));
	}
}
