package com.outreach.scoring.model;

import com.outreach.scoring.model.config.PriorityThresholds;

public enum PriorityTier {
    EXCLUDED,
    LOW,
    MEDIUM,
    HIGH;

    /**
     * Compares the score against the thresholds in descending order; below the lowest it is EXCLUDED.
     */
    public static PriorityTier fromScore(double score, PriorityThresholds thresholds) {
        if (score >= thresholds.getHighPriority()) return HIGH;
        if (score >= thresholds.getMediumPriority()) return MEDIUM;
        if (score >= thresholds.getLowPriority()) return LOW;
        return EXCLUDED;
    }
}
