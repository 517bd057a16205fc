package com.newsinsight.reliability.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps reliability errors to the JSON error body
 * {@code {success, error, message, status, timestamp}}.
 */
@RestControllerAdvice(basePackages = "com.newsinsight.reliability.controller")
@Slf4j
public class ReliabilityExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(ValidationException ex) {
        log.debug("Validation error: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBindException(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.debug("Request validation failed: {}", message);
        return respond(HttpStatus.BAD_REQUEST, createErrorResponse("VALIDATION_ERROR", message, HttpStatus.BAD_REQUEST));
    }

    /**
     * Unreadable JSON or unknown enum values in the request body.
     */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleInputException(ServerWebInputException ex) {
        String message = ex.getMostSpecificCause().getMessage();
        log.debug("Malformed request: {}", message);
        return respond(HttpStatus.BAD_REQUEST,
                createErrorResponse("VALIDATION_ERROR", "Malformed request: " + ex.getReason(), HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFoundException(NotFoundException ex) {
        log.info("Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND));
    }

    @ExceptionHandler(WorkerAbortedException.class)
    public ResponseEntity<Map<String, Object>> handleWorkerAbortedException(WorkerAbortedException ex) {
        log.error("Worker aborted: {}", ex.getMessage(), ex);
        Map<String, Object> response = createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR);
        response.put("unprocessedDomains", ex.getUnprocessedDomains());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, response);
    }

    @ExceptionHandler(ReliabilityException.class)
    public ResponseEntity<Map<String, Object>> handleReliabilityException(ReliabilityException ex) {
        log.error("Reliability error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                createErrorResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
                createErrorResponse("INTERNAL_ERROR", "An unexpected error occurred", HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, Map<String, Object> body) {
        return ResponseEntity.status(status).body(body);
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return response;
    }
}
