package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@Schema(description = "Tier thresholds, strictly ordered high > medium > low")
public class PriorityThresholds {

    @JsonProperty("high_priority")
    @Schema(example = "100")
    double highPriority;

    @JsonProperty("medium_priority")
    @Schema(example = "50")
    double mediumPriority;

    @JsonProperty("low_priority")
    @Schema(example = "10")
    double lowPriority;

    @JsonProperty("score_floor")
    @Schema(description = "Lowest value penalties may push the final score to", example = "0")
    double scoreFloor;
}
