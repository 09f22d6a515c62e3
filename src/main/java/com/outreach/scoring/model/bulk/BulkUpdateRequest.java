package com.outreach.scoring.model.bulk;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Sparse field patch applied to many stored lists")
public class BulkUpdateRequest {

    @JsonAlias("filenames")
    @Schema(description = "Identifiers (file names) of the lists to update",
            example = "[\"italy_hydraulics.lvp\", \"germany_oem.csv\"]")
    private List<Object> identifiers;

    @JsonAlias("updates")
    @Schema(description = "Field to new value; allowed fields: country, category, priority, processed, description, display_name",
            example = "{\"country\": \"Italy\", \"priority\": 100}")
    private Map<String, Object> patch;
}
