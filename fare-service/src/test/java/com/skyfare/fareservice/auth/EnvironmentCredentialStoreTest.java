package com.skyfare.fareservice.auth;

import com.skyfare.common.exception.CredentialException;
import com.skyfare.fareservice.config.AmadeusProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentCredentialStoreTest {

	private static EnvironmentCredentialStore storeWith(String key, String secret) {
		AmadeusProperties properties = new AmadeusProperties();
		properties.setApiKey(key);
		properties.setApiSecret(secret);
		return new EnvironmentCredentialStore(properties);
	}

	@Test
	void resolve_whenBothPresent_thenReturnsTrimmedCredential() {
		Credential credential = storeWith(" key ", "secret\n").resolve();

		assertEquals("key", credential.clientId());
		assertEquals("secret", credential.clientSecret());
	}

	@Test
	void resolve_whenSecretMissing_thenThrows() {
		CredentialException ex = assertThrows(CredentialException.class, () -> storeWith("key", null).resolve());

		assertEquals(EnvironmentCredentialStore.MISSING_CREDENTIALS_MESSAGE, ex.getMessage());
	}

	@Test
	void resolve_whenKeyBlank_thenThrows() {
		assertThrows(CredentialException.class, () -> storeWith("  ", "secret").resolve());
	}

	@Test
	void credentialToString_doesNotLeakSecret() {
		Credential credential = new Credential("my-client-id", "my-client-secret");

		assertFalse(credential.toString().contains("my-client-secret"));
	}
}
