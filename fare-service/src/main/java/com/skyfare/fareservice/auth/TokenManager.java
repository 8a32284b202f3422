package com.skyfare.fareservice.auth;

import com.skyfare.common.exception.AuthFailureException;
import com.skyfare.common.exception.CredentialException;
import com.skyfare.common.util.SensitiveDataFilter;
import com.skyfare.fareservice.config.AmadeusProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

/**
 * Hands out bearer tokens: from the {@link TokenStore} while they are usable, otherwise from a
 * fresh client-credentials exchange that replaces the stored one.
 *
 * <p>Refreshes go through a single flight keyed by environment, so concurrent callers with an
 * empty or expired cache share one exchange. The cache is checked again inside the flight for
 * callers that arrive just after a refresh completed.
 */
@Service
@Slf4j
public class TokenManager {

	private static final String SINGLE_FLIGHT_KEY_PREFIX = "amadeus:token:";

	private final CredentialStore credentialStore;
	private final TokenStore tokenStore;
	private final OAuthTokenClient oauthTokenClient;
	private final SingleFlightExecutor singleFlightExecutor;
	private final Clock clock;
	private final String singleFlightKey;
	private final Counter refreshCounter;

	public TokenManager(
			CredentialStore credentialStore,
			TokenStore tokenStore,
			OAuthTokenClient oauthTokenClient,
			SingleFlightExecutor singleFlightExecutor,
			Clock clock,
			AmadeusProperties properties,
			MeterRegistry meterRegistry) {
		this.credentialStore = credentialStore;
		this.tokenStore = tokenStore;
		this.oauthTokenClient = oauthTokenClient;
		this.singleFlightExecutor = singleFlightExecutor;
		this.clock = clock;
		this.singleFlightKey = SINGLE_FLIGHT_KEY_PREFIX + properties.resolveEnvironment().getKey();
		this.refreshCounter = Counter.builder("amadeus.token.refreshes")
			.description("Number of OAuth token exchanges")
			.tag("client", "amadeus")
			.register(meterRegistry);
	}

	/**
	 * @return a bearer token valid for more than {@link CachedToken#SAFETY_BUFFER}
	 * @throws CredentialException if a new token is needed and credentials are missing
	 * @throws AuthFailureException if the token endpoint rejects the credentials
	 */
	public String getAccessToken() {
		return currentToken().accessToken();
	}

	/**
	 * Same as {@link #getAccessToken()} but returns the full record (type, expiry).
	 */
	public CachedToken currentToken() {
		Optional<CachedToken> cached = usableCachedToken();
		if (cached.isPresent()) {
			return cached.get();
		}
		return singleFlightExecutor.execute(singleFlightKey, () -> usableCachedToken().orElseGet(this::refresh));
	}

	/**
	 * Drops the stored token and exchanges a new one.
	 */
	public CachedToken forceRefresh() {
		return singleFlightExecutor.execute(singleFlightKey, () -> {
			tokenStore.clear();
			return refresh();
		});
	}

	/**
	 * The stored token, if any, without refreshing. May be expired.
	 */
	public Optional<CachedToken> peek() {
		return tokenStore.load();
	}

	public boolean isUsable(CachedToken token) {
		return token.isUsableAt(clock.instant());
	}

	public void invalidate() {
		tokenStore.clear();
		log.info("Cached access token invalidated");
	}

	private Optional<CachedToken> usableCachedToken() {
		Instant now = clock.instant();
		return tokenStore.load().filter(token -> token.isUsableAt(now));
	}

	private CachedToken refresh() {
		Credential credential = credentialStore.resolve();

		OAuthTokenClient.TokenResponse response = oauthTokenClient.exchange(credential);
		refreshCounter.increment();

		CachedToken token = CachedToken.issuedAt(
			clock.instant(), response.getAccessToken(), response.getTokenType(), response.getExpiresIn());
		tokenStore.save(token);

		log.info("Obtained new access token {} valid until {}",
			SensitiveDataFilter.previewToken(token.accessToken()), token.expiresAt());
		return token;
	}
}
