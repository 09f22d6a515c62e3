package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "A configured keyword that contributed to the relevance score")
public class KeywordMatch {

    @Schema(example = "hydraulic pump")
    String term;

    KeywordPolarity polarity;

    KeywordTier tier;

    @Schema(description = "Configured weight magnitude", example = "1.0")
    double weight;

    @Schema(description = "Signed relevance points contributed", example = "20.0")
    double points;

    @Schema(description = "Start offset of the counted occurrence in the matched text", example = "14")
    int start;
}
