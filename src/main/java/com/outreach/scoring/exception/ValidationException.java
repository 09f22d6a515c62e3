package com.outreach.scoring.exception;

/**
 * Thrown when a request is malformed. Raised before any record is scored or stored data is touched.
 */
public class ValidationException extends RuntimeException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
