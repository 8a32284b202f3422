package com.skyfare.fareservice.auth;

import com.skyfare.common.exception.ExternalApiException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
public class InMemorySingleFlightExecutor implements SingleFlightExecutor {

	private final ConcurrentHashMap<String, CompletableFuture<?>> inFlightRequests = new ConcurrentHashMap<>();
	private final Duration followerTimeout;

	public InMemorySingleFlightExecutor(Duration followerTimeout) {
		this.followerTimeout = followerTimeout;
	}

	@Override
	@SuppressWarnings("unchecked")
	public <T> T execute(String key, SingleFlightOperation<T> operation) {
		if (key == null || key.isBlank()) {
			throw new IllegalArgumentException("Key cannot be null or empty");
		}

		CompletableFuture<T> newFuture = new CompletableFuture<>();
		CompletableFuture<T> existing = (CompletableFuture<T>) inFlightRequests.putIfAbsent(key, newFuture);

		if (existing == null) {
			try {
				T result = operation.execute();
				newFuture.complete(result);
				return result;
			} catch (RuntimeException e) {
				newFuture.completeExceptionally(e);
				throw e;
			} finally {
				inFlightRequests.remove(key, newFuture);
			}
		}

		log.debug("Joining in-flight operation for key={}", key);
		try {
			return existing.get(followerTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (ExecutionException e) {
			if (e.getCause() instanceof RuntimeException cause) {
				throw cause;
			}
			throw new ExternalApiException("In-flight operation failed for key=" + key, e.getCause());
		} catch (TimeoutException e) {
			throw new ExternalApiException("Timed out waiting for in-flight operation key=" + key, e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ExternalApiException("Interrupted while waiting for in-flight operation key=" + key, e);
		}
	}
}
