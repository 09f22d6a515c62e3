package com.outreach.scoring.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A record to score, with an inline configuration or a template name")
public class ScoreRequest {

    private ContactRecord record;

    @Schema(description = "Inline rule configuration document; takes precedence over template")
    private JsonNode configuration;

    @Schema(description = "Built-in template name; the default template is used when both are absent",
            example = "italy_hydraulics")
    private String template;
}
