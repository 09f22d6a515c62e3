package com.outreach.scoring.exception;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a rule-configuration document fails validation. Nothing is constructed.
 * Carries every violation found; the first one is exposed through {@link #getPath()} and {@link #getReason()}.
 */
public class SchemaException extends RuntimeException {

    private final List<SchemaViolation> violations;

    public SchemaException(List<SchemaViolation> violations) {
        super(violations.stream().map(SchemaViolation::toString).collect(Collectors.joining("; ")));
        if (violations.isEmpty()) {
            throw new IllegalArgumentException("SchemaException requires at least one violation");
        }
        this.violations = List.copyOf(violations);
    }

    public SchemaException(String path, String reason) {
        this(List.of(new SchemaViolation(path, reason)));
    }

    public List<SchemaViolation> getViolations() {
        return violations;
    }

    public String getPath() {
        return violations.get(0).path();
    }

    public String getReason() {
        return violations.get(0).reason();
    }
}
