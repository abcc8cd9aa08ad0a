package com.transmissionweb.feeder.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps feed-service errors to JSON error bodies.
 */
@RestControllerAdvice(basePackages = "com.transmissionweb.feeder.controller")
@Slf4j
public class FeederExceptionHandler {

    @ExceptionHandler(FeedNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(FeedNotFoundException ex) {
        log.debug("Feed not found: {}", ex.getFeedId());
        return respond(HttpStatus.NOT_FOUND, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(InvalidPatternException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidPattern(InvalidPatternException ex) {
        log.warn("Rejected pattern {}: {}", ex.getPattern(), ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(FeedPersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(FeedPersistenceException ex) {
        log.warn("Persistence error: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler({RpcTransportException.class, RpcProtocolException.class, FeedFetchException.class})
    public ResponseEntity<Map<String, Object>> handleUpstream(FeederException ex) {
        log.error("Upstream error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(FeederException.class)
    public ResponseEntity<Map<String, Object>> handleFeederException(FeederException ex) {
        log.error("Feeder error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getErrorCode(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message);
    }

    @ExceptionHandler({IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> respond(HttpStatus status, String errorCode, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        return ResponseEntity.status(status).body(response);
    }
}
