package com.outreach.scoring.model;

public enum RecordStatus {
    SCORED,
    INVALID_RECORD
}
