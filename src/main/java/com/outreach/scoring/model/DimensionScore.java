package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Contribution of one dimension to the composite score")
public class DimensionScore {

    ScoringDimension dimension;

    @Schema(description = "Dimension value before weighting, 0-100", example = "80.0")
    double rawScore;

    @Schema(description = "Renormalized weight", example = "0.45")
    double weight;

    @Schema(description = "rawScore x weight", example = "36.0")
    double weightedScore;
}
