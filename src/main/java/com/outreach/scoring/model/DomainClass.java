package com.outreach.scoring.model;

/**
 * Classification of an email domain against the configured domain lists.
 */
public enum DomainClass {
    CORPORATE,
    FREE_MAIL,
    DISPOSABLE,
    SUSPICIOUS,
    UNCLASSIFIED
}
