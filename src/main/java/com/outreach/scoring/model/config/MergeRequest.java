package com.outreach.scoring.model.config;

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
@Schema(description = "Deep merge of a partial override onto a base configuration")
public class MergeRequest {

    @Schema(description = "Base configuration document; alternative to baseTemplate")
    private JsonNode base;

    @Schema(description = "Built-in template used as base when no base document is given", example = "generic")
    private String baseTemplate;

    @Schema(description = "Partial document; objects merge recursively, arrays and values replace, null removes")
    private JsonNode override;
}
