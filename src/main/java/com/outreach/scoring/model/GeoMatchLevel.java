package com.outreach.scoring.model;

/**
 * Which geographic rule produced a record's multiplier, most specific first.
 */
public enum GeoMatchLevel {
    COUNTRY,
    REGION,
    OTHERS,
    EXCLUDED,
    NONE
}
