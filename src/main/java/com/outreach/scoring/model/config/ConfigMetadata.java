package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Descriptive metadata of a rule configuration")
public class ConfigMetadata {

    @Schema(description = "Configuration identifier", example = "italy_hydraulics")
    String id;

    @Schema(description = "Display name (1-100 characters)", example = "Italy Hydraulics")
    String name;

    @Schema(description = "Optional description (max 500 characters)")
    String description;

    @Schema(description = "Major.minor version", example = "1.0")
    String version;

    String author;

    String created;

    String updated;
}
