package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@Schema(description = "Outcome of the geographic lookup for a record")
public class GeoMatch {

    GeoMatchLevel level;

    @Schema(description = "Multiplier key that matched (country, region or 'Others')", example = "Italy")
    String matchedKey;

    @Schema(example = "2.0")
    double multiplier;

    @Schema(description = "Whether the record's country equals the configured target country")
    boolean targetCountry;
}
