package com.skyfare.fareservice.client;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;

import java.time.Duration;

/**
 * Rate-limit retry policy: up to {@code maxAttempts} calls, waiting
 * {@code initialBackoff * multiplier^(k-1)} before retry k. With the defaults
 * (3 attempts, 1 s, x2) that is 1 s then 2 s.
 *
 * <p>Only {@link RequestOutcome.RateLimited} is retried. Exceptions are never retried.
 */
@Getter
public class RetryPolicy {

	private final int maxAttempts;
	private final Duration initialBackoff;
	private final double multiplier;
	private final IntervalFunction intervalFunction;

	public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
			throw new IllegalArgumentException("initialBackoff must be positive");
		}
		if (multiplier < 1.0) {
			throw new IllegalArgumentException("multiplier must be >= 1.0");
		}
		this.maxAttempts = maxAttempts;
		this.initialBackoff = initialBackoff;
		this.multiplier = multiplier;
		this.intervalFunction = IntervalFunction.ofExponentialBackoff(initialBackoff, multiplier);
	}

	public static RetryPolicy defaults() {
		return new RetryPolicy(3, Duration.ofSeconds(1), 2.0);
	}

	/**
	 * @param retry 1 for the first retry (second attempt)
	 */
	public Duration waitBeforeRetry(int retry) {
		if (retry < 1) {
			throw new IllegalArgumentException("retry must be >= 1");
		}
		return Duration.ofMillis(intervalFunction.apply(retry));
	}

	/**
	 * A fresh Retry per call, so attempt counters are never shared between calls.
	 */
	public Retry newRetry(String name) {
		RetryConfig config = RetryConfig.<RequestOutcome>custom()
			.maxAttempts(maxAttempts)
			.intervalFunction(intervalFunction)
			.retryOnResult(outcome -> outcome instanceof RequestOutcome.RateLimited)
			.retryOnException(e -> false)
			.build();
		return Retry.of(name, config);
	}
}
