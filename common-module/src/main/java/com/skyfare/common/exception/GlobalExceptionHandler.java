package com.skyfare.common.exception;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.skyfare.common.dto.ErrorResponseDTO;
import com.skyfare.common.util.SensitiveDataFilter;
import io.swagger.v3.oas.annotations.Hidden;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;

@RestControllerAdvice
@Order(1)
@Hidden
@Slf4j
public class GlobalExceptionHandler {
	
	private static final String URI_PREFIX = "uri=";
	private static final String UNKNOWN_PATH = "unknown";
	private static final String FAVICON_PATH = "favicon.ico";
	
	private static final String VALIDATION_FAILED_MESSAGE = "Validation failed";
	private static final String UNEXPECTED_ERROR_MESSAGE = "An unexpected error occurred";
	private static final String INVALID_ARGUMENT_MESSAGE = "Invalid argument provided";
	private static final String UNKNOWN_ERROR_MESSAGE = "Unknown error";
	private static final String CREDENTIALS_MESSAGE = "Missing credentials. Set AMADEUS_API_KEY and AMADEUS_API_SECRET.";
	
	private static final String ERROR_CODE_NOT_FOUND = "NOT_FOUND";
	private static final String ERROR_CODE_CREDENTIALS_MISSING = "CREDENTIALS_MISSING";
	private static final String ERROR_CODE_UPSTREAM_AUTH_FAILED = "UPSTREAM_AUTH_FAILED";
	private static final String ERROR_CODE_UPSTREAM_BAD_REQUEST = "UPSTREAM_BAD_REQUEST";
	private static final String ERROR_CODE_UPSTREAM_ERROR = "UPSTREAM_ERROR";
	private static final String ERROR_CODE_EXTERNAL_API_ERROR = "EXTERNAL_API_ERROR";
	private static final String ERROR_CODE_RATE_LIMIT_EXCEEDED = "RATE_LIMIT_EXCEEDED";
	private static final String ERROR_CODE_SERIALIZATION_ERROR = "SERIALIZATION_ERROR";
	private static final String ERROR_CODE_BUSINESS_ERROR = "BUSINESS_ERROR";
	private static final String ERROR_CODE_VALIDATION_ERROR = "VALIDATION_ERROR";
	private static final String ERROR_CODE_INVALID_ARGUMENT = "INVALID_ARGUMENT";
	private static final String ERROR_CODE_INTERNAL_ERROR = "INTERNAL_ERROR";
	
	private static final int MAX_MESSAGE_LENGTH = 200;
	private static final String MESSAGE_TRUNCATION_SUFFIX = "...";
	
	@ExceptionHandler(CredentialException.class)
	public ResponseEntity<ErrorResponseDTO> handleCredentialException(CredentialException ex, WebRequest request) {
		log.error("Credential error: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_CREDENTIALS_MISSING, CREDENTIALS_MESSAGE, HttpStatus.INTERNAL_SERVER_ERROR, request);
	}
	
	@ExceptionHandler(AuthFailureException.class)
	public ResponseEntity<ErrorResponseDTO> handleAuthFailureException(AuthFailureException ex, WebRequest request) {
		log.error("Upstream authentication failed: {}", sanitizeMessage(ex.getMessage()));
		return buildErrorResponse(ERROR_CODE_UPSTREAM_AUTH_FAILED, sanitizeMessage(ex.getMessage()), HttpStatus.BAD_GATEWAY, request);
	}
	
	@ExceptionHandler(RateLimitExceededException.class)
	public ResponseEntity<ErrorResponseDTO> handleRateLimitExceededException(RateLimitExceededException ex, WebRequest request) {
		log.warn("Rate limit exceeded: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_RATE_LIMIT_EXCEEDED, ex.getMessage(), HttpStatus.TOO_MANY_REQUESTS, request);
	}
	
	@ExceptionHandler(ClientErrorException.class)
	public ResponseEntity<ErrorResponseDTO> handleClientErrorException(ClientErrorException ex, WebRequest request) {
		log.warn("Upstream rejected request: {}", sanitizeMessage(ex.getDetail()));
		// upstream detail is returned verbatim
		return buildErrorResponse(ERROR_CODE_UPSTREAM_BAD_REQUEST, ex.getMessage(), HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(UpstreamServiceException.class)
	public ResponseEntity<ErrorResponseDTO> handleUpstreamServiceException(UpstreamServiceException ex, WebRequest request) {
		log.error("Upstream error [{}]: {}", ex.getStatus(), sanitizeMessage(ex.getResponseBody()));
		String message = StringUtils.isNotBlank(ex.getResponseBody())
			? ex.getMessage() + ": " + truncateMessage(ex.getResponseBody())
			: ex.getMessage();
		return buildErrorResponse(ERROR_CODE_UPSTREAM_ERROR, message, HttpStatus.BAD_GATEWAY, request);
	}
	
	@ExceptionHandler(ExternalApiException.class)
	public ResponseEntity<ErrorResponseDTO> handleExternalApiException(ExternalApiException ex, WebRequest request) {
		String sanitizedMessage = sanitizeMessage(ex.getMessage());
		log.error("External API error: {}", sanitizedMessage);
		return buildErrorResponse(ERROR_CODE_EXTERNAL_API_ERROR, sanitizedMessage, HttpStatus.SERVICE_UNAVAILABLE, request);
	}
	
	@ExceptionHandler(JsonProcessingException.class)
	public ResponseEntity<ErrorResponseDTO> handleJsonProcessingException(JsonProcessingException ex, WebRequest request) {
		log.error("JSON processing error: {}", ex.getMessage(), ex);
		return buildErrorResponse(ERROR_CODE_SERIALIZATION_ERROR, "Failed to process JSON data", HttpStatus.INTERNAL_SERVER_ERROR, request);
	}
	
	@ExceptionHandler(SerializationException.class)
	public ResponseEntity<ErrorResponseDTO> handleSerializationException(SerializationException ex, WebRequest request) {
		log.error("Serialization error: {}", ex.getMessage(), ex);
		return buildErrorResponse(ERROR_CODE_SERIALIZATION_ERROR, ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, request);
	}
	
	@ExceptionHandler(BusinessException.class)
	public ResponseEntity<ErrorResponseDTO> handleBusinessException(BusinessException ex, WebRequest request) {
		log.error("Business error: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_BUSINESS_ERROR, ex.getMessage(), HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(MethodArgumentNotValidException.class)
	public ResponseEntity<ErrorResponseDTO> handleValidationException(MethodArgumentNotValidException ex, WebRequest request) {
		log.error("Validation error: {}", ex.getMessage());
		String message = ex.getBindingResult().getFieldErrors().stream()
			.map(error -> String.format("%s: %s", error.getField(), error.getDefaultMessage()))
			.reduce((a, b) -> String.format("%s, %s", a, b))
			.orElse(VALIDATION_FAILED_MESSAGE);
		
		return buildErrorResponse(ERROR_CODE_VALIDATION_ERROR, message, HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(ConstraintViolationException.class)
	public ResponseEntity<ErrorResponseDTO> handleConstraintViolationException(ConstraintViolationException ex, WebRequest request) {
		log.error("Constraint violation: {}", ex.getMessage());
		String message = StringUtils.defaultIfBlank(ex.getMessage(), VALIDATION_FAILED_MESSAGE);
		return buildErrorResponse(ERROR_CODE_VALIDATION_ERROR, message, HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(HandlerMethodValidationException.class)
	public ResponseEntity<ErrorResponseDTO> handleHandlerMethodValidationException(HandlerMethodValidationException ex, WebRequest request) {
		log.warn("Parameter validation failed: {}", ex.getMessage());
		String message = ex.getAllErrors().stream()
			.map(MessageSourceResolvable::getDefaultMessage)
			.filter(StringUtils::isNotBlank)
			.reduce((a, b) -> String.format("%s, %s", a, b))
			.orElse(VALIDATION_FAILED_MESSAGE);
		return buildErrorResponse(ERROR_CODE_VALIDATION_ERROR, message, HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(HttpMessageNotReadableException.class)
	public ResponseEntity<ErrorResponseDTO> handleHttpMessageNotReadableException(HttpMessageNotReadableException ex, WebRequest request) {
		log.warn("Unreadable request body: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_INVALID_ARGUMENT, "Request body is missing or is not valid JSON", HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
	public ResponseEntity<ErrorResponseDTO> handleRequestParameterException(Exception ex, WebRequest request) {
		log.warn("Invalid request parameter: {}", ex.getMessage());
		return buildErrorResponse(ERROR_CODE_INVALID_ARGUMENT, ex.getMessage(), HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ErrorResponseDTO> handleIllegalArgumentException(IllegalArgumentException ex, WebRequest request) {
		log.error("Illegal argument: {}", ex.getMessage());
		String message = ex.getMessage() != null ? ex.getMessage() : INVALID_ARGUMENT_MESSAGE;
		return buildErrorResponse(ERROR_CODE_INVALID_ARGUMENT, message, HttpStatus.BAD_REQUEST, request);
	}
	
	@ExceptionHandler(NoResourceFoundException.class)
	public ResponseEntity<?> handleNoResourceFoundException(NoResourceFoundException ex, WebRequest request) {
		String path = extractPath(request);
		
		if (path.contains(FAVICON_PATH)) {
			log.debug("Favicon not found: {}", path);
			return ResponseEntity.notFound().build();
		}
		
		log.warn("Resource not found: {}", path);
		return buildErrorResponse(ERROR_CODE_NOT_FOUND, ex.getMessage(), HttpStatus.NOT_FOUND, request);
	}
	
	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponseDTO> handleGenericException(Exception ex, WebRequest request) {
		String errorMessage = sanitizeMessage(ex.getMessage());
		
		log.error("Unexpected error: {}", errorMessage != null ? errorMessage : UNKNOWN_ERROR_MESSAGE, ex);
		return buildErrorResponse(ERROR_CODE_INTERNAL_ERROR, UNEXPECTED_ERROR_MESSAGE, HttpStatus.INTERNAL_SERVER_ERROR, request);
	}
	
	private ResponseEntity<ErrorResponseDTO> buildErrorResponse(String errorCode, String message, 
	                                                             HttpStatus status, WebRequest request) {
		ErrorResponseDTO error = ErrorResponseDTO.builder()
			.errorCode(errorCode)
			.message(message)
			.timestamp(LocalDateTime.now())
			.path(extractPath(request))
			.build();
		return new ResponseEntity<>(error, status);
	}
	
	private String extractPath(WebRequest request) {
		try {
			String description = request.getDescription(false);
			if (StringUtils.isEmpty(description)) {
				return UNKNOWN_PATH;
			}
			return description.replace(URI_PREFIX, "");
		} catch (RuntimeException e) {
			log.warn("Failed to extract path from request", e);
			return UNKNOWN_PATH;
		}
	}
	
	private String truncateMessage(String message) {
		if (message == null) {
			return null;
		}
		if (message.length() > MAX_MESSAGE_LENGTH) {
			return message.substring(0, MAX_MESSAGE_LENGTH) + MESSAGE_TRUNCATION_SUFFIX;
		}
		return message;
	}
	
	/**
	 * Masks credentials and tokens, then truncates.
	 */
	private String sanitizeMessage(String message) {
		if (message == null) {
			return null;
		}
		return truncateMessage(SensitiveDataFilter.maskSensitiveData(message));
	}
}
