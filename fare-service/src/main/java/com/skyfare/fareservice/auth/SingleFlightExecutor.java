package com.skyfare.fareservice.auth;

/**
 * Runs an operation at most once at a time per key. Callers arriving while it is in flight
 * wait for the leader and get its result or its failure.
 */
public interface SingleFlightExecutor {

	/**
	 * @param key identifies the operation; concurrent calls with equal keys share one execution
	 * @param operation the work, executed by the first caller only
	 * @param <T> result type
	 * @return the leader's result
	 * @throws RuntimeException the leader's failure, rethrown to every waiting caller
	 */
	<T> T execute(String key, SingleFlightOperation<T> operation);

	@FunctionalInterface
	interface SingleFlightOperation<T> {
		T execute();
	}
}
