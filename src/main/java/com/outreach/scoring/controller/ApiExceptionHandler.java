package com.outreach.scoring.controller;

import com.outreach.scoring.exception.SchemaException;
import com.outreach.scoring.exception.SizeLimitException;
import com.outreach.scoring.exception.StorageException;
import com.outreach.scoring.exception.TargetsNotFoundException;
import com.outreach.scoring.exception.TemplateNotFoundException;
import com.outreach.scoring.exception.ValidationException;
import com.outreach.scoring.model.bulk.BulkUpdateResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps the error taxonomy to HTTP. Requests rejected before processing get 400/413 with
 * {error, field}; a processed bulk update whose targets were all missing gets 404 with the
 * full per-target response.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SchemaException.class)
    public ResponseEntity<Map<String, Object>> handleSchema(SchemaException e) {
        log.warn("Configuration rejected: {}", e.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getReason());
        body.put("field", e.getPath());
        body.put("violations", e.getViolations().stream()
                .map(v -> Map.of("path", v.path(), "reason", v.reason()))
                .toList());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, String>> handleValidation(ValidationException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage(), "field", e.getField()));
    }

    @ExceptionHandler(SizeLimitException.class)
    public ResponseEntity<Map<String, Object>> handleSizeLimit(SizeLimitException e) {
        log.warn("Request rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(Map.of("error", "Request too large", "size", e.getSize(), "limit", e.getLimit()));
    }

    @ExceptionHandler(TargetsNotFoundException.class)
    public ResponseEntity<BulkUpdateResponse> handleTargetsNotFound(TargetsNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getResponse());
    }

    @ExceptionHandler(TemplateNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleTemplateNotFound(TemplateNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage(), "field", "template"));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("success", false, "error", e.getMessage(), "errors", List.of(e.getMessage())));
    }
}
