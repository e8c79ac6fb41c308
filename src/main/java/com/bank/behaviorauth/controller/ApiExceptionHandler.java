package com.bank.behaviorauth.controller;

import com.bank.behaviorauth.exception.CapacityExceededException;
import com.bank.behaviorauth.exception.ConfigurationException;
import com.bank.behaviorauth.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        log.debug("Rejected request: field={}, error={}", e.getField(), e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException e) {
        log.warn("Rejected configuration change: field={}, error={}", e.getField(), e.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<Map<String, Object>> handleCapacity(CapacityExceededException e) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", e.getMessage(), "limit", e.getLimit()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body", "field", "body"));
    }
}
