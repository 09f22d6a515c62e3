package com.outreach.scoring.engine;

import java.util.Locale;
import java.util.Optional;

public final class Texts {

    private Texts() {
    }

    /**
     * Lower-cases and collapses whitespace. Null and blank input both become the empty string.
     */
    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
    }

    /**
     * True when both values are equal after {@link #normalize}; blank values never match.
     */
    public static boolean sameText(String a, String b) {
        String normalized = normalize(a);
        return !normalized.isEmpty() && normalized.equals(normalize(b));
    }

    /**
     * The first configured value that is the {@link #sameText same text} as the candidate.
     */
    public static Optional<String> find(Iterable<String> values, String candidate) {
        for (String value : values) {
            if (sameText(value, candidate)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static boolean containsIgnoreCase(Iterable<String> values, String candidate) {
        return find(values, candidate).isPresent();
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
