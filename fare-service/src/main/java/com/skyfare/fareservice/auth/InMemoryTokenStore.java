package com.skyfare.fareservice.auth;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

public class InMemoryTokenStore implements TokenStore {

	private final AtomicReference<CachedToken> current = new AtomicReference<>();

	@Override
	public Optional<CachedToken> load() {
		return Optional.ofNullable(current.get());
	}

	@Override
	public void save(CachedToken token) {
		current.set(token);
	}

	@Override
	public void clear() {
		current.set(null);
	}
}
