package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@Schema(description = "Target and excluded regions plus per-country/region multipliers")
public class GeographicRules {

    public static final String OTHERS = "Others";

    @JsonProperty("target_regions")
    @Builder.Default
    List<String> targetRegions = List.of();

    @JsonProperty("exclude_regions")
    @Builder.Default
    List<String> excludeRegions = List.of();

    @Schema(description = "Country or region name to multiplier; the key 'Others' is the fallback",
            example = "{\"Italy\": 2.0, \"Central Europe\": 1.2, \"Others\": 0.5}")
    @Builder.Default
    Map<String, Double> multipliers = Map.of();

    @JsonProperty("region_members")
    @Schema(description = "Region name to member countries", example = "{\"Central Europe\": [\"Germany\", \"Austria\"]}")
    @Builder.Default
    Map<String, List<String>> regionMembers = Map.of();

    public static GeographicRules empty() {
        return GeographicRules.builder().build();
    }
}
