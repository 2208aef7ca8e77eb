package com.hotelbot.assistant.controller;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Renders every error as {@code {status, error}}. Server-side failures are logged with
 * their cause and answered with the generic reason only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<?> handleResponseStatus(ResponseStatusException ex) {
        int status = ex.getStatusCode().value();
        if (status >= 500) {
            log.error("Request failed: {}", ex.getReason(), ex.getCause() != null ? ex.getCause() : ex);
        }
        return ResponseEntity.status(status).body(Map.of(
                "status", status,
                "error", ex.getReason() == null ? "Error" : ex.getReason()
        ));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<?> handleBadRequest(Exception ex) {
        return ResponseEntity.status(400).body(Map.of(
                "status", 400,
                "error", "Malformed request"
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<?> handleConstraintViolation(ConstraintViolationException ex) {
        return ResponseEntity.status(400).body(Map.of(
                "status", 400,
                "error", ex.getMessage()
        ));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<?> handleMethodValidation(HandlerMethodValidationException ex) {
        return ResponseEntity.status(400).body(Map.of(
                "status", 400,
                "error", "Invalid request parameter"
        ));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity.status(500).body(Map.of(
                "status", 500,
                "error", "Internal server error"
        ));
    }
}
