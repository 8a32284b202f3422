package com.skyfare.common.exception;

/**
 * Upstream rejected the credentials (token exchange) or the bearer token (HTTP 401 on a call).
 */
public class AuthFailureException extends ExternalApiException {
	
	public AuthFailureException(String message) {
		super(message);
	}
	
	public AuthFailureException(String message, Throwable cause) {
		super(message, cause);
	}
}
