package com.outreach.scoring.model;

/**
 * Anomaly severity, ordered: NONE < LOW < MEDIUM < HIGH < CRITICAL.
 */
public enum Severity {
    NONE,
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
