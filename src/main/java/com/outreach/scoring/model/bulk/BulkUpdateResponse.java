package com.outreach.scoring.model.bulk;

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
@Schema(description = "Aggregate and per-target outcome of a processed bulk update")
public class BulkUpdateResponse {

    @Schema(description = "True only when no target failed", example = "false")
    private boolean success;

    @Schema(example = "2")
    private int updated;

    @Schema(example = "1")
    private int failed;

    @Schema(example = "[\"List not found: missing.lvp\"]")
    private List<String> errors;

    private List<TargetResult> results;

    @Schema(description = "Final request state", example = "PARTIAL")
    private RequestState state;
}
