package com.outreach.scoring.exception;

/**
 * Persistence failed after validation passed. The previous stored state remains in place.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageException(String message) {
        super(message);
    }
}
