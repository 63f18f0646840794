package com.shipmenttelemetry.engine.controller;

import com.shipmenttelemetry.engine.exception.ErrorKind;
import com.shipmenttelemetry.engine.exception.ShipmentPipelineException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps typed pipeline errors to JSON error bodies carrying the error kind and whether the
 * same request may be retried.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case MALFORMED_TELEMETRY -> HttpStatus.BAD_REQUEST;
            case TOKEN_VALIDATION, RELATION_VALIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case INVALID_STATE_TRANSITION -> HttpStatus.CONFLICT;
            case TOKEN_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case PERSISTENCE, GEOFENCE_CATALOG_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    @ExceptionHandler(ShipmentPipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(ShipmentPipelineException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", e.getKind(), e);
        } else {
            log.warn("Request rejected with {}: {}", e.getKind(), e.getMessage());
        }
        Map<String, Object> body = errorBody(e.getMessage());
        body.put("errorKind", e.getKind());
        body.put("retryable", e.isRetryable());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidRequest(MethodArgumentNotValidException e) {
        List<String> details = e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .toList();
        Map<String, Object> body = errorBody("Invalid request");
        body.put("details", details);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(errorBody("Malformed request body"));
    }

    private Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
