package com.outreach.scoring.model;

public enum AdjustmentKind {
    BONUS,
    PENALTY
}
