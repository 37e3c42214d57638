package com.pinwatch.governance.controller;

import com.pinwatch.governance.replay.ReplayStoreUnavailableException;
import com.pinwatch.governance.scan.MalformedPayloadException;
import com.pinwatch.governance.security.WebhookAuthenticationException;
import com.pinwatch.governance.service.DeliveryInProgressException;
import java.time.Instant;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(WebhookAuthenticationException.class)
    public ResponseEntity<Map<String, Object>> handleUnauthorized(WebhookAuthenticationException ex) {
        return error(HttpStatus.UNAUTHORIZED, "unauthorized", ex.getMessage());
    }

    @ExceptionHandler({MalformedPayloadException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getName() + " has an invalid value");
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(RunNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(DeliveryInProgressException.class)
    public ResponseEntity<Map<String, Object>> handleInProgress(DeliveryInProgressException ex) {
        return error(HttpStatus.CONFLICT, "in_progress", ex.getMessage());
    }

    @ExceptionHandler(ReplayStoreUnavailableException.class)
    public ResponseEntity<Map<String, Object>> handleReplayStore(ReplayStoreUnavailableException ex) {
        LOGGER.error("Rejecting webhook: {}", ex.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "unavailable", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGeneric(Exception ex) {
        LOGGER.error("Request failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error",
            ex.getMessage() == null ? "unexpected error" : ex.getMessage());
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Map.of(
            "timestamp", Instant.now().toString(),
            "error", code,
            "message", message == null ? code : message
        ));
    }
}
