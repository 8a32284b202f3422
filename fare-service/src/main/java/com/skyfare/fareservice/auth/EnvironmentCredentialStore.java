package com.skyfare.fareservice.auth;

import com.skyfare.common.exception.CredentialException;
import com.skyfare.fareservice.config.AmadeusProperties;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * Reads AMADEUS_API_KEY / AMADEUS_API_SECRET through {@code amadeus.api-key} and
 * {@code amadeus.api-secret}. Resolution is lazy: the service starts without credentials
 * and fails on the first call that needs a token.
 */
@Component
@RequiredArgsConstructor
public class EnvironmentCredentialStore implements CredentialStore {

	static final String MISSING_CREDENTIALS_MESSAGE = "Missing credentials. Set AMADEUS_API_KEY and AMADEUS_API_SECRET.";

	private final AmadeusProperties properties;

	@Override
	public Credential resolve() {
		String clientId = properties.getApiKey();
		String clientSecret = properties.getApiSecret();

		if (StringUtils.isBlank(clientId) || StringUtils.isBlank(clientSecret)) {
			throw new CredentialException(MISSING_CREDENTIALS_MESSAGE);
		}
		return new Credential(clientId.trim(), clientSecret.trim());
	}
}
