package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Target market of a rule configuration")
public class TargetProfile {

    @Schema(description = "Target country", example = "Italy")
    String country;

    @Schema(description = "Target industry", example = "Hydraulics")
    String industry;

    @Schema(description = "Outreach languages (1-5)", example = "[\"en\", \"it\"]")
    List<String> languages;
}
