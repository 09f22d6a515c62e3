package com.outreach.scoring.engine;

import java.util.Locale;

/**
 * Structural measurements of an email address. Addresses without '@' are measured as a bare local part.
 */
public final class AddressMetrics {

    private final String localPart;
    private final String domain;
    private final int digitCount;
    private final int separatorCount;
    private final int unusualCount;

    private AddressMetrics(String localPart, String domain) {
        this.localPart = localPart;
        this.domain = domain;
        int digits = 0;
        int separators = 0;
        int unusual = 0;
        for (int i = 0; i < localPart.length(); i++) {
            char c = localPart.charAt(i);
            if (Character.isDigit(c)) {
                digits++;
            } else if (c == '.' || c == '_' || c == '-') {
                separators++;
            } else if (!Character.isLetter(c)) {
                unusual++;
            }
        }
        this.digitCount = digits;
        this.separatorCount = separators;
        this.unusualCount = unusual;
    }

    public static AddressMetrics of(String email) {
        String normalized = email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
        int at = normalized.lastIndexOf('@');
        if (at < 0) {
            return new AddressMetrics(normalized, "");
        }
        return new AddressMetrics(normalized.substring(0, at), normalized.substring(at + 1));
    }

    public String localPart() {
        return localPart;
    }

    public String domain() {
        return domain;
    }

    public int localLength() {
        return localPart.length();
    }

    public int domainLength() {
        return domain.length();
    }

    public double digitRatio() {
        return ratio(digitCount);
    }

    public double separatorRatio() {
        return ratio(separatorCount);
    }

    // Characters that are neither alphanumeric nor a common separator (. _ -).
    public double specialCharRatio() {
        return ratio(unusualCount);
    }

    private double ratio(int count) {
        return localPart.isEmpty() ? 0.0 : (double) count / localPart.length();
    }
}
