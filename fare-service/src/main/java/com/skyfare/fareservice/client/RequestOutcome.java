package com.skyfare.fareservice.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;

/**
 * Result of one dispatched call. Transport exceptions never cross the dispatcher; they
 * arrive here as {@link NetworkError}.
 */
public sealed interface RequestOutcome permits RequestOutcome.Success, RequestOutcome.RateLimited,
	RequestOutcome.AuthFailure, RequestOutcome.ClientError, RequestOutcome.ServerError, RequestOutcome.NetworkError {

	default boolean isSuccess() {
		return this instanceof Success;
	}

	/** 2xx with its parsed JSON body. */
	record Success(JsonNode body) implements RequestOutcome {
	}

	/**
	 * 429. Only seen inside the retry loop; once the ceiling is reached the dispatcher throws.
	 * The hint is the Retry-After header, or null when absent.
	 */
	record RateLimited(Duration retryAfterHint) implements RequestOutcome {
	}

	/** 401. Never retried. */
	record AuthFailure(String detail) implements RequestOutcome {
	}

	/** 400, with the first structured error detail or the raw body. */
	record ClientError(String detail) implements RequestOutcome {
	}

	/** Any other non-2xx status. */
	record ServerError(int status, String body) implements RequestOutcome {
	}

	/** Connection refused, timeout, I/O failure. */
	record NetworkError(String message) implements RequestOutcome {
	}
}
