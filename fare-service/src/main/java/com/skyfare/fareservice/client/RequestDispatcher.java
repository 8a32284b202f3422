package com.skyfare.fareservice.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.common.exception.AuthFailureException;
import com.skyfare.common.exception.ClientErrorException;
import com.skyfare.common.exception.ExternalApiException;
import com.skyfare.common.exception.RetriesExhaustedException;
import com.skyfare.common.exception.SerializationException;
import com.skyfare.common.exception.UpstreamServiceException;
import com.skyfare.common.util.SensitiveDataFilter;
import com.skyfare.fareservice.auth.TokenManager;
import com.skyfare.fareservice.config.AmadeusProperties;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Issues bearer-authenticated calls against the travel API and classifies the response.
 *
 * <p>Policy:
 * <ul>
 *   <li>429 → retried per {@link RetryPolicy}; past the ceiling → RetriesExhaustedException</li>
 *   <li>401 → AuthFailure, never retried</li>
 *   <li>400 → ClientError with the first {@code errors[].detail}, else the raw body</li>
 *   <li>other non-2xx → ServerError(status, body)</li>
 *   <li>transport errors → NetworkError</li>
 *   <li>2xx → Success(parsed JSON)</li>
 * </ul>
 *
 * <p>Each call gets its own retry context, so concurrent calls never share attempt counters.
 */
@Service
@Slf4j
public class RequestDispatcher {

	private final TokenManager tokenManager;
	private final RestTemplate metadataRestTemplate;
	private final RestTemplate searchRestTemplate;
	private final ObjectMapper objectMapper;
	private final RetryPolicy retryPolicy;
	private final AmadeusClientMetrics metrics;
	private final AmadeusProperties properties;

	public RequestDispatcher(
			TokenManager tokenManager,
			@Qualifier("metadataRestTemplate") RestTemplate metadataRestTemplate,
			@Qualifier("searchRestTemplate") RestTemplate searchRestTemplate,
			ObjectMapper objectMapper,
			RetryPolicy retryPolicy,
			AmadeusClientMetrics metrics,
			AmadeusProperties properties) {
		this.tokenManager = tokenManager;
		this.metadataRestTemplate = metadataRestTemplate;
		this.searchRestTemplate = searchRestTemplate;
		this.objectMapper = objectMapper;
		this.retryPolicy = retryPolicy;
		this.metrics = metrics;
		this.properties = properties;
	}

	/**
	 * @return the classified outcome; never {@link RequestOutcome.RateLimited}
	 * @throws RetriesExhaustedException if every attempt was rate limited
	 * @throws com.skyfare.common.exception.CredentialException if no token can be minted for lack of credentials
	 * @throws AuthFailureException if the token exchange itself is rejected
	 */
	public RequestOutcome execute(ApiRequest request) {
		String token = tokenManager.getAccessToken();
		URI uri = buildUri(request);
		HttpEntity<String> entity = buildEntity(request, token);

		AtomicReference<RequestOutcome> last = new AtomicReference<>();
		Retry retry = retryPolicy.newRetry(request.describe());
		retry.getEventPublisher().onRetry(event -> log.warn("Rate limited on {} (Retry-After {}), waiting {} ms before attempt {}/{}",
			request.describe(), describeHint(last.get()), event.getWaitInterval().toMillis(),
			event.getNumberOfRetryAttempts() + 1, retryPolicy.getMaxAttempts()));

		RequestOutcome outcome = retry.executeSupplier(() -> {
			RequestOutcome result = attempt(request, uri, entity);
			last.set(result);
			return result;
		});

		if (outcome instanceof RequestOutcome.RateLimited) {
			metrics.onRetriesExhausted();
			log.error("Giving up on {} after {} rate-limited attempts", request.describe(), retryPolicy.getMaxAttempts());
			throw new RetriesExhaustedException(retryPolicy.getMaxAttempts());
		}
		if (!outcome.isSuccess()) {
			metrics.onError();
		}
		return outcome;
	}

	/**
	 * Like {@link #execute(ApiRequest)} but turns every non-success outcome into an exception.
	 *
	 * @return the JSON body of a 2xx response
	 * @throws AuthFailureException on 401
	 * @throws ClientErrorException on 400
	 * @throws UpstreamServiceException on any other non-2xx
	 * @throws ExternalApiException on transport failure
	 */
	public JsonNode executeOrThrow(ApiRequest request) {
		RequestOutcome outcome = execute(request);

		if (outcome instanceof RequestOutcome.Success success) {
			return success.body();
		}
		if (outcome instanceof RequestOutcome.AuthFailure authFailure) {
			throw new AuthFailureException(authFailure.detail());
		}
		if (outcome instanceof RequestOutcome.ClientError clientError) {
			throw new ClientErrorException(clientError.detail());
		}
		if (outcome instanceof RequestOutcome.ServerError serverError) {
			throw new UpstreamServiceException(serverError.status(), serverError.body());
		}
		if (outcome instanceof RequestOutcome.NetworkError networkError) {
			throw new ExternalApiException("Travel API call failed: " + networkError.message());
		}
		throw new IllegalStateException("Unexpected outcome " + outcome);
	}

	private RequestOutcome attempt(ApiRequest request, URI uri, HttpEntity<String> entity) {
		metrics.onRequest();
		log.debug("{} {}", request.getMethod(), uri);

		ResponseEntity<String> response;
		try {
			response = metrics.recordLatency(() -> restTemplate(request).exchange(uri, request.getMethod(), entity, String.class));
		} catch (RestClientResponseException e) {
			return classify(e.getStatusCode().value(), e.getResponseBodyAsString(), e.getResponseHeaders());
		} catch (RestClientException e) {
			log.warn("Transport error on {}: {}", request.describe(), e.getMessage());
			return new RequestOutcome.NetworkError(StringUtils.defaultIfBlank(e.getMessage(), e.getClass().getSimpleName()));
		}

		return classify(response.getStatusCode().value(), response.getBody(), response.getHeaders());
	}

	private RequestOutcome classify(int status, String body, HttpHeaders headers) {
		if (status >= 200 && status < 300) {
			return new RequestOutcome.Success(parseBody(body));
		}
		if (status == HttpStatus.TOO_MANY_REQUESTS.value()) {
			Duration hint = retryAfter(headers);
			metrics.onRateLimited(hint);
			return new RequestOutcome.RateLimited(hint);
		}
		if (status == HttpStatus.UNAUTHORIZED.value()) {
			return new RequestOutcome.AuthFailure("Authentication failed. Check AMADEUS_API_KEY and AMADEUS_API_SECRET.");
		}
		if (status == HttpStatus.BAD_REQUEST.value()) {
			return new RequestOutcome.ClientError(extractErrorDetail(body));
		}
		log.warn("Travel API returned HTTP {}: {}", status, SensitiveDataFilter.maskSensitiveData(body));
		return new RequestOutcome.ServerError(status, body);
	}

	/**
	 * First {@code errors[].detail} of an error envelope, else the raw body.
	 */
	String extractErrorDetail(String body) {
		if (StringUtils.isBlank(body)) {
			return StringUtils.defaultString(body);
		}
		try {
			JsonNode errors = objectMapper.readTree(body).path("errors");
			if (errors.isArray() && !errors.isEmpty()) {
				JsonNode detail = errors.get(0).path("detail");
				if (detail.isTextual() && StringUtils.isNotBlank(detail.asText())) {
					return detail.asText();
				}
			}
		} catch (JsonProcessingException e) {
			log.debug("400 body is not JSON, using raw text");
		}
		return body;
	}

	private JsonNode parseBody(String body) {
		if (StringUtils.isBlank(body)) {
			return objectMapper.createObjectNode();
		}
		try {
			return objectMapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw new SerializationException("Failed to parse travel API response", e);
		}
	}

	private Duration retryAfter(HttpHeaders headers) {
		if (headers == null) {
			return null;
		}
		String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
		if (StringUtils.isNumeric(value)) {
			return Duration.ofSeconds(Long.parseLong(value));
		}
		return null;
	}

	private static String describeHint(RequestOutcome outcome) {
		if (outcome instanceof RequestOutcome.RateLimited rateLimited && rateLimited.retryAfterHint() != null) {
			return rateLimited.retryAfterHint().getSeconds() + "s";
		}
		return "none";
	}

	private URI buildUri(ApiRequest request) {
		UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.resolveBaseUrl())
			.path(request.getPath());
		request.getParams().forEach(builder::queryParam);
		return builder.encode().build().toUri();
	}

	private HttpEntity<String> buildEntity(ApiRequest request, String token) {
		HttpHeaders headers = new HttpHeaders();
		headers.setBearerAuth(token);
		headers.setAccept(List.of(MediaType.APPLICATION_JSON));

		if (request.getMethod() == HttpMethod.POST) {
			headers.setContentType(MediaType.APPLICATION_JSON);
			return new HttpEntity<>(writeBody(request.getBody()), headers);
		}
		return new HttpEntity<>(headers);
	}

	private String writeBody(JsonNode body) {
		if (body == null) {
			return "{}";
		}
		try {
			return objectMapper.writeValueAsString(body);
		} catch (JsonProcessingException e) {
			throw new SerializationException("Failed to serialize request body", e);
		}
	}

	private RestTemplate restTemplate(ApiRequest request) {
		return request.getCallType() == CallType.SEARCH ? searchRestTemplate : metadataRestTemplate;
	}
}
