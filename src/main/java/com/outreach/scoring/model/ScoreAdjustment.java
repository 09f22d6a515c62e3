package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A multiplicative bonus or penalty applied after weighting")
public class ScoreAdjustment {

    @Schema(example = "oemEquipment")
    String name;

    AdjustmentKind kind;

    @Schema(example = "1.3")
    double multiplier;

    @Schema(example = "Matched keyword 'manufacturer'")
    String reason;
}
