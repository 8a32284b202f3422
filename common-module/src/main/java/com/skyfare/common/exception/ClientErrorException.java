package com.skyfare.common.exception;

import lombok.Getter;

/**
 * HTTP 400 from the upstream API. The detail is the first structured error detail of the body,
 * or the raw body when it carries none.
 */
@Getter
public class ClientErrorException extends ExternalApiException {

	private final String detail;

	public ClientErrorException(String detail) {
		super("Bad request: " + detail);
		this.detail = detail;
	}
}
