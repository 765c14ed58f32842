package com.example.bully.networking.http;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.example.bully.exception.ConsistencyViolationException;
import com.example.bully.exception.InvalidCommandException;
import com.example.bully.exception.ReplicationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Maps failures of client and replica calls to HTTP responses.
 * Retryable replication errors become 503 so that clients try again, possibly
 * on another replica.
 */
@Slf4j
@RestControllerAdvice
public class ReplicationExceptionHandler {

    @ExceptionHandler(ReplicationException.class)
    public ResponseEntity<Map<String, Object>> handleReplicationException(ReplicationException ex) {
        if (ex instanceof ConsistencyViolationException) {
            log.error("Consistency violation: {}", ex.getMessage());
        } else if (ex.isRetryable()) {
            log.warn("Retryable replication failure {}: {}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.error("Replication failure {}: {}", ex.getErrorCode(), ex.getMessage());
        }
        Map<String, Object> body = body(ex.getErrorCode().name(), ex.getMessage());
        body.put("retryable", ex.isRetryable());
        HttpStatus status = ex.isRetryable() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(InvalidCommandException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidCommand(InvalidCommandException ex) {
        log.debug("Rejected command: {}", ex.getMessage());
        Map<String, Object> body = body(ex.getErrorCode().name(), ex.getMessage());
        body.put("retryable", false);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        log.debug("Rejected request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(body("BAD_REQUEST", ex.getMessage()));
    }

    /**
     * Raised while the replica is stopped or still starting
     */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(IllegalStateException ex) {
        log.debug("Replica not ready: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body("NOT_READY", ex.getMessage()));
    }

    private static Map<String, Object> body(String errorType, String message) {
        Map<String, Object> body = new HashMap<>();
        body.put("timestamp", LocalDateTime.now());
        body.put("errorType", errorType);
        body.put("message", message);
        return body;
    }
}
