package com.skyfare.fareservice.auth;

import com.skyfare.common.util.SensitiveDataFilter;

public record Credential(String clientId, String clientSecret) {

	@Override
	public String toString() {
		return "Credential[clientId=" + SensitiveDataFilter.previewToken(clientId) + ", clientSecret=***]";
	}
}
