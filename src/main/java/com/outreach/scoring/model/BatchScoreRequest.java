package com.outreach.scoring.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Records to score against one configuration")
public class BatchScoreRequest {

    private List<ContactRecord> records;

    @Schema(description = "Inline rule configuration document; takes precedence over template")
    private JsonNode configuration;

    @Schema(example = "germany_manufacturing")
    private String template;
}
