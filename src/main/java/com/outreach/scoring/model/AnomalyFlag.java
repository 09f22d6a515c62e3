package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "One heuristic that fired for a record")
public class AnomalyFlag {

    AnomalyType type;

    Severity severity;

    @Schema(example = "Matches spam-trap signature 'role-account'")
    String reason;
}
