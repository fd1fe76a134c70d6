package com.linlay.calendarassistant.controller;

import com.linlay.calendarassistant.model.api.ApiResponse;
import com.linlay.calendarassistant.service.ThreadNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.TreeMap;

/**
 * Maps failures of the calendar endpoints onto the {@link ApiResponse} envelope. The message
 * stream itself never fails this way: once submitted, errors travel on the status and text
 * channels.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ThreadNotFoundException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleThreadNotFound(ThreadNotFoundException ex) {
        return failure(HttpStatus.NOT_FOUND, ex.getMessage(), Map.of("threadId", String.valueOf(ex.getThreadId())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleIllegalArgument(IllegalArgumentException ex) {
        return failure(HttpStatus.BAD_REQUEST, ex.getMessage(), Map.of());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleValidation(WebExchangeBindException ex) {
        Map<String, String> fields = new TreeMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            fields.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return failure(HttpStatus.BAD_REQUEST, "Validation failed", Map.of("fields", fields));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleUnreadableInput(ServerWebInputException ex) {
        log.debug("Rejected request input: {}", ex.getReason());
        return failure(HttpStatus.BAD_REQUEST, "Malformed request body", Map.of());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        String message = ex.getReason();
        if (!StringUtils.hasText(message)) {
            HttpStatus resolved = HttpStatus.resolve(statusCode.value());
            message = resolved == null ? "Request failed" : resolved.getReasonPhrase();
        }
        return failure(statusCode, message, Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Map<String, Object>>> handleUnexpected(Exception ex) {
        log.error("Unhandled calendar API failure", ex);
        return failure(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error", Map.of());
    }

    private ResponseEntity<ApiResponse<Map<String, Object>>> failure(
            HttpStatusCode status,
            String message,
            Map<String, Object> data
    ) {
        return ResponseEntity.status(status).body(ApiResponse.failure(status.value(), message, data));
    }
}
