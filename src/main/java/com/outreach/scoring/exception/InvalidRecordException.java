package com.outreach.scoring.exception;

/**
 * Feature extraction could not process a record (e.g. a malformed identifier).
 * Batch scoring converts this into an INVALID_RECORD result instead of aborting.
 */
public class InvalidRecordException extends RuntimeException {

    private final String identifier;

    public InvalidRecordException(String identifier, String message) {
        super(message);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
