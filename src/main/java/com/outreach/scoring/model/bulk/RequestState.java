package com.outreach.scoring.model.bulk;

/**
 * Lifecycle of a bulk update: RECEIVED -> VALIDATED -> {APPLIED | REJECTED | PARTIAL}.
 */
public enum RequestState {
    RECEIVED,
    VALIDATED,
    APPLIED,
    REJECTED,
    PARTIAL
}
