package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A named adjustment: multiplier above 1.0 is a bonus, below 1.0 a penalty.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Keyword-triggered multiplicative bonus or penalty")
public class DomainRule {

    @Schema(example = "[\"oem\", \"manufacturer\", \"factory\"]")
    List<String> keywords;

    @Schema(example = "1.3")
    double multiplier;

    @Schema(description = "Where keywords are matched: company/description text or the email domain", example = "text")
    @Builder.Default
    DomainRuleScope scope = DomainRuleScope.TEXT;

    @JsonIgnore
    public boolean isBonus() {
        return multiplier > 1.0;
    }
}
