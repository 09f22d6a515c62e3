package com.outreach.scoring.model.bulk;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stored metadata of one contact list. Fields this service does not know are kept as-is.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Metadata of a stored contact list")
public class ListEntry {

    @Schema(example = "italy_hydraulics.lvp")
    private String filename;

    @JsonProperty("display_name")
    @Schema(example = "Italy hydraulics (verified)")
    private String displayName;

    @Schema(example = "Italy")
    private String country;

    @Schema(example = "Hydraulics")
    private String category;

    @Schema(example = "100")
    private Integer priority;

    private Boolean processed;

    private String description;

    @Builder.Default
    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    public void apply(PatchField field, Object value) {
        switch (field) {
            case COUNTRY -> country = (String) value;
            case CATEGORY -> category = (String) value;
            case PRIORITY -> priority = (Integer) value;
            case PROCESSED -> processed = (Boolean) value;
            case DESCRIPTION -> description = (String) value;
            case DISPLAY_NAME -> displayName = (String) value;
        }
    }
}
