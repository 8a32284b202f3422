package com.skyfare.fareservice.controller;

import com.skyfare.common.exception.CredentialException;
import com.skyfare.common.util.SensitiveDataFilter;
import com.skyfare.fareservice.auth.CachedToken;
import com.skyfare.fareservice.auth.CredentialStore;
import com.skyfare.fareservice.auth.TokenManager;
import com.skyfare.fareservice.config.AmadeusProperties;
import com.skyfare.fareservice.controller.dto.AuthStatusDTO;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/auth")
@Slf4j
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Access token status and refresh")
public class AuthController {

	private final TokenManager tokenManager;
	private final CredentialStore credentialStore;
	private final AmadeusProperties properties;

	@GetMapping("/status")
	@Operation(summary = "Environment, credential and cached token status", description = "Never returns the token itself.")
	public ResponseEntity<AuthStatusDTO> status() {
		Optional<CachedToken> cached = tokenManager.peek();

		AuthStatusDTO status = AuthStatusDTO.builder()
			.environment(properties.resolveEnvironment().getKey())
			.baseUrl(properties.resolveBaseUrl())
			.credentialsConfigured(credentialsConfigured())
			.tokenCached(cached.isPresent())
			.tokenValid(cached.map(tokenManager::isUsable).orElse(false))
			.tokenPreview(cached.map(t -> SensitiveDataFilter.previewToken(t.accessToken())).orElse(null))
			.expiresAt(cached.map(CachedToken::expiresAt).orElse(null))
			.build();
		return ResponseEntity.ok(status);
	}

	@PostMapping("/token/refresh")
	@Operation(summary = "Discard the cached token and obtain a new one")
	public ResponseEntity<AuthStatusDTO> refresh() {
		CachedToken token = tokenManager.forceRefresh();
		log.info("Access token refreshed on request");

		AuthStatusDTO status = AuthStatusDTO.builder()
			.environment(properties.resolveEnvironment().getKey())
			.baseUrl(properties.resolveBaseUrl())
			.credentialsConfigured(true)
			.tokenCached(true)
			.tokenValid(true)
			.tokenPreview(SensitiveDataFilter.previewToken(token.accessToken()))
			.expiresAt(token.expiresAt())
			.build();
		return ResponseEntity.ok(status);
	}

	private boolean credentialsConfigured() {
		try {
			credentialStore.resolve();
			return true;
		} catch (CredentialException e) {
			return false;
		}
	}
}
