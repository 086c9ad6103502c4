package com.easycashflows.controller;

import com.easycashflows.service.dispatch.UnknownProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Error mapping for the internal business-event API. Webhook endpoints never reach it.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = NotificationEventController.class)
public class ApiExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getField)
                .map(field -> field + " is required")
                .collect(Collectors.joining(", "));
        log.warn("Rejected business event: {}", details);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", details));
    }

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<Map<String, String>> handleUnknownProvider(UnknownProviderException ex) {
        log.warn("Rejected business event: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Rejected business event: unreadable body");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of("error", "Malformed request body"));
    }
}
