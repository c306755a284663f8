package com.shlawgathon.featuretracker.backend.controller;

import com.shlawgathon.featuretracker.backend.exception.ProductDataCorruptedException;
import com.shlawgathon.featuretracker.backend.exception.ResourceNotFoundException;
import com.shlawgathon.featuretracker.backend.exception.TaxonomyConflictException;
import com.shlawgathon.featuretracker.backend.exception.WorkspaceBusyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to {@code {"error": ..., "message": ...}} responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(TaxonomyConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(TaxonomyConflictException ex) {
        return error(HttpStatus.CONFLICT, "taxonomy_conflict", ex.getMessage());
    }

    @ExceptionHandler(WorkspaceBusyException.class)
    public ResponseEntity<Map<String, Object>> handleBusy(WorkspaceBusyException ex) {
        return error(HttpStatus.CONFLICT, "busy", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException ex) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "validation_failed", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_json", "Request body could not be read");
    }

    @ExceptionHandler(ProductDataCorruptedException.class)
    public ResponseEntity<Map<String, Object>> handleCorrupted(ProductDataCorruptedException ex) {
        log.error("[API] {}", ex.getMessage());
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "corrupted_data", ex.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
