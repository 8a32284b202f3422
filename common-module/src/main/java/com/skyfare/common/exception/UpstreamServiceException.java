package com.skyfare.common.exception;

import lombok.Getter;

@Getter
public class UpstreamServiceException extends ExternalApiException {

	private final int status;
	private final String responseBody;

	public UpstreamServiceException(int status, String responseBody) {
		super(String.format("Upstream API returned HTTP status %d", status));
		this.status = status;
		this.responseBody = responseBody;
	}
}
