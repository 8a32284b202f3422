package com.skyfare.common.exception;

import lombok.Getter;

/**
 * Thrown when an upstream call kept answering HTTP 429 until the retry ceiling was reached.
 */
@Getter
public class RetriesExhaustedException extends RateLimitExceededException {

	private final int attempts;

	public RetriesExhaustedException(int attempts) {
		super(String.format("Max retries exceeded due to rate limiting (%d attempts)", attempts));
		this.attempts = attempts;
	}
}
