package com.skyfare.fareservice.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skyfare.common.exception.AuthFailureException;
import com.skyfare.common.exception.ExternalApiException;
import com.skyfare.common.util.SensitiveDataFilter;
import com.skyfare.fareservice.config.AmadeusProperties;
import com.skyfare.fareservice.constants.AmadeusConstants;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * OAuth2 client-credentials exchange against {@code /v1/security/oauth2/token}.
 *
 * <p>Error handling:
 * <ul>
 *   <li>HTTP 401 → AuthFailureException</li>
 *   <li>Other non-2xx, transport errors, unparseable body → ExternalApiException</li>
 * </ul>
 */
@Component
@Slf4j
public class OAuthTokenClient {

	private final RestTemplate restTemplate;
	private final ObjectMapper objectMapper;
	private final AmadeusProperties properties;

	public OAuthTokenClient(
			@Qualifier("metadataRestTemplate") RestTemplate restTemplate,
			ObjectMapper objectMapper,
			AmadeusProperties properties) {
		this.restTemplate = restTemplate;
		this.objectMapper = objectMapper;
		this.properties = properties;
	}

	/**
	 * @return the parsed token response, {@code access_token} guaranteed non-blank
	 */
	public TokenResponse exchange(Credential credential) {
		String url = properties.resolveBaseUrl() + AmadeusConstants.TOKEN_PATH;

		HttpHeaders headers = new HttpHeaders();
		headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
		headers.setAccept(List.of(MediaType.APPLICATION_JSON));

		MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
		form.add("grant_type", "client_credentials");
		form.add("client_id", credential.clientId());
		form.add("client_secret", credential.clientSecret());

		log.debug("Requesting new access token from {}", url);

		ResponseEntity<String> response;
		try {
			response = restTemplate.exchange(url, HttpMethod.POST, new HttpEntity<>(form, headers), String.class);
		} catch (RestClientResponseException e) {
			throw failure(e.getStatusCode().value(), e.getResponseBodyAsString());
		} catch (RestClientException e) {
			throw new ExternalApiException("Token request failed (transport error)", e);
		}

		if (!response.getStatusCode().is2xxSuccessful()) {
			throw failure(response.getStatusCode().value(), response.getBody());
		}

		TokenResponse token = parse(response.getBody());
		if (StringUtils.isBlank(token.getAccessToken())) {
			throw new ExternalApiException("Token response did not contain access_token");
		}
		return token;
	}

	private RuntimeException failure(int status, String body) {
		if (status == HttpStatus.UNAUTHORIZED.value()) {
			return new AuthFailureException("Authentication failed. Check AMADEUS_API_KEY and AMADEUS_API_SECRET.");
		}
		log.warn("Token endpoint returned HTTP {}: {}", status, SensitiveDataFilter.maskSensitiveData(body));
		return new ExternalApiException("Token endpoint returned HTTP status: " + status);
	}

	private TokenResponse parse(String body) {
		if (StringUtils.isBlank(body)) {
			throw new ExternalApiException("Token endpoint returned an empty body");
		}
		try {
			return objectMapper.readValue(body, TokenResponse.class);
		} catch (JsonProcessingException e) {
			throw new ExternalApiException("Failed to parse token response", e);
		}
	}

	@Data
	@NoArgsConstructor
	@JsonIgnoreProperties(ignoreUnknown = true)
	public static class TokenResponse {

		@ToString.Exclude
		@JsonProperty("access_token")
		private String accessToken;

		@JsonProperty("token_type")
		private String tokenType;

		@JsonProperty("expires_in")
		private Long expiresIn;
	}
}
