package com.skyfare.fareservice.controller.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class AuthStatusDTO {

	private String environment;
	private String baseUrl;
	private boolean credentialsConfigured;
	private boolean tokenCached;
	private boolean tokenValid;
	private String tokenPreview;
	private Instant expiresAt;
}
