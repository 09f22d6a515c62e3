package com.outreach.scoring.model;

public enum KeywordTier {
    PRIMARY,
    SECONDARY
}
