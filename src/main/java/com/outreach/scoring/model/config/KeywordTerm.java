package com.outreach.scoring.model.config;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * A configured keyword. The weight is a magnitude; polarity comes from the list the term sits in.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Weighted keyword matched against company and domain text")
public class KeywordTerm {

    @Schema(example = "hydraulic pump")
    String term;

    @Schema(example = "1.0")
    double weight;
}
