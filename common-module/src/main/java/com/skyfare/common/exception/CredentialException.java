package com.skyfare.common.exception;

/**
 * Client credentials are missing or empty. Fatal, never retried.
 */
public class CredentialException extends BusinessException {
	
	public CredentialException(String message) {
		super(message);
	}
}
