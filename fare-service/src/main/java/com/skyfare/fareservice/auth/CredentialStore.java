package com.skyfare.fareservice.auth;

import com.skyfare.common.exception.CredentialException;

/**
 * Source of the OAuth client credentials.
 */
public interface CredentialStore {

	/**
	 * @return the client credentials, both fields non-blank
	 * @throws CredentialException if either field is missing or empty
	 */
	Credential resolve();
}
