package com.skyfare.common.exception;

public class SerializationException extends BusinessException {
	
	public SerializationException(String message) {
		super(message);
	}
	
	public SerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
