package com.skyfare.fareservice.auth;

import java.util.Optional;

/**
 * Single-record store for the current bearer token. A save replaces the previous record.
 */
public interface TokenStore {

	/**
	 * @return the stored token, or empty when nothing usable is stored (missing, unreadable, malformed)
	 */
	Optional<CachedToken> load();

	void save(CachedToken token);

	void clear();
}
