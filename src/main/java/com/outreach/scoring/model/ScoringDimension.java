package com.outreach.scoring.model;

public enum ScoringDimension {
    QUALITY,
    RELEVANCE,
    GEOGRAPHY,
    ENGAGEMENT
}
