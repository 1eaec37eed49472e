package com.marketdata.jobs.controller;

import com.marketdata.jobs.exception.InvalidScheduleException;
import com.marketdata.jobs.exception.JobAlreadyRunningException;
import com.marketdata.jobs.exception.JobNotFoundException;
import com.marketdata.jobs.exception.ProviderException;
import com.marketdata.jobs.exception.ScanNotFoundException;
import com.marketdata.jobs.exception.UpstreamAuthException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Maps service exceptions to JSON error bodies.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler({IllegalArgumentException.class, InvalidScheduleException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "Malformed request body");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
        return error(HttpStatus.BAD_REQUEST, "validation_error", ex.getMessage());
    }

    @ExceptionHandler({JobNotFoundException.class, ScanNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(JobAlreadyRunningException.class)
    public ResponseEntity<Map<String, Object>> conflict(JobAlreadyRunningException ex) {
        return error(HttpStatus.CONFLICT, "already_running", ex.getMessage());
    }

    @ExceptionHandler({UpstreamAuthException.class, ProviderException.class})
    public ResponseEntity<Map<String, Object>> upstream(RuntimeException ex) {
        log.warn("Upstream failure surfaced to caller: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, "upstream_error", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String reason, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "status", "error",
                "reason", reason,
                "message", message == null ? "invalid_request" : message,
                "ts", Instant.now().toString()
        ));
    }
}
