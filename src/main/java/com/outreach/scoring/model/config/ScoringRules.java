package com.outreach.scoring.model.config;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ScoringRules {

    ScoringWeights weights;

    PriorityThresholds thresholds;
}
