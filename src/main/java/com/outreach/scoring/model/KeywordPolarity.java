package com.outreach.scoring.model;

public enum KeywordPolarity {
    POSITIVE,
    NEGATIVE
}
