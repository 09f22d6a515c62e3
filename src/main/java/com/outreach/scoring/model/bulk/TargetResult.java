package com.outreach.scoring.model.bulk;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Outcome of a bulk update for one identifier")
public class TargetResult {

    @Schema(example = "italy_hydraulics.lvp")
    private String identifier;

    private boolean success;

    @Schema(example = "List not found")
    private String error;

    public static TargetResult ok(String identifier) {
        return TargetResult.builder().identifier(identifier).success(true).build();
    }

    public static TargetResult failed(String identifier, String error) {
        return TargetResult.builder().identifier(identifier).success(false).error(error).build();
    }
}
