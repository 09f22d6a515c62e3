package com.outreach.scoring.exception;

/**
 * A single rule-configuration problem, qualified by the dotted path of the offending field.
 */
public record SchemaViolation(String path, String reason) {

    @Override
    public String toString() {
        return path + ": " + reason;
    }
}
