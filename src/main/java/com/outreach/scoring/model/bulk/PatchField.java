package com.outreach.scoring.model.bulk;

import com.outreach.scoring.exception.ValidationException;

import java.util.Arrays;
import java.util.Optional;

/**
 * Whitelist of list fields a bulk patch may touch, with each field's type/range check.
 */
public enum PatchField {
    COUNTRY("country"),
    CATEGORY("category"),
    PRIORITY("priority"),
    PROCESSED("processed"),
    DESCRIPTION("description"),
    DISPLAY_NAME("display_name");

    public static final int MIN_PRIORITY = 50;
    public static final int MAX_PRIORITY = 999;

    private final String wireName;

    PatchField(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<PatchField> fromWireName(String name) {
        return Arrays.stream(values()).filter(f -> f.wireName.equals(name)).findFirst();
    }

    /**
     * Checks the value and returns it in its stored form.
     *
     * @throws ValidationException naming the field when the value is out of type or range
     */
    public Object validate(Object value) {
        String field = "patch." + wireName;
        switch (this) {
            case COUNTRY, CATEGORY -> {
                if (!(value instanceof String s) || s.isBlank()) {
                    throw new ValidationException(field, wireName + " must be non-empty string");
                }
                return s.trim();
            }
            case PRIORITY -> {
                if (!(value instanceof Integer || value instanceof Long || value instanceof Short)) {
                    throw new ValidationException(field, "priority must be integer between "
                            + MIN_PRIORITY + " and " + MAX_PRIORITY);
                }
                long priority = ((Number) value).longValue();
                if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
                    throw new ValidationException(field, "priority must be integer between "
                            + MIN_PRIORITY + " and " + MAX_PRIORITY + " (got " + priority + ")");
                }
                return (int) priority;
            }
            case PROCESSED -> {
                if (!(value instanceof Boolean)) {
                    throw new ValidationException(field, "processed must be boolean");
                }
                return value;
            }
            default -> {
                if (!(value instanceof String)) {
                    throw new ValidationException(field, wireName + " must be string");
                }
                return value;
            }
        }
    }
}
