package com.skyfare.fareservice.auth;

import com.skyfare.common.util.SensitiveDataFilter;

import java.time.Duration;
import java.time.Instant;

/**
 * A bearer token and the instant it stops being accepted upstream.
 */
public record CachedToken(String accessToken, String tokenType, long expiresIn, Instant expiresAt) {

	/**
	 * Margin for clock skew and request latency. A token inside it counts as expired.
	 */
	public static final Duration SAFETY_BUFFER = Duration.ofSeconds(60);

	public static final long DEFAULT_EXPIRES_IN_SECONDS = 1799L;
	public static final String DEFAULT_TOKEN_TYPE = "Bearer";

	public boolean isUsableAt(Instant now) {
		return accessToken != null
			&& !accessToken.isBlank()
			&& expiresAt != null
			&& expiresAt.isAfter(now.plus(SAFETY_BUFFER));
	}

	public static CachedToken issuedAt(Instant now, String accessToken, String tokenType, Long expiresIn) {
		long lifetime = expiresIn != null ? expiresIn : DEFAULT_EXPIRES_IN_SECONDS;
		String type = tokenType != null && !tokenType.isBlank() ? tokenType : DEFAULT_TOKEN_TYPE;
		return new CachedToken(accessToken, type, lifetime, now.plusSeconds(lifetime));
	}

	@Override
	public String toString() {
		return "CachedToken[accessToken=" + SensitiveDataFilter.previewToken(accessToken)
			+ ", tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", expiresAt=" + expiresAt + "]";
	}
}
