package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Per-dimension weights. They need not sum to 1.0; {@link #normalized()} rescales them.
 */
@Value
@Builder(toBuilder = true)
@Schema(description = "Relative weight of each scoring dimension")
public class ScoringWeights {

    @JsonProperty("email_quality")
    @Schema(example = "0.10")
    double emailQuality;

    @JsonProperty("company_relevance")
    @Schema(example = "0.45")
    double companyRelevance;

    @JsonProperty("geographic_priority")
    @Schema(example = "0.30")
    double geographicPriority;

    @Schema(example = "0.15")
    double engagement;

    public double total() {
        return emailQuality + companyRelevance + geographicPriority + engagement;
    }

    /**
     * Returns weights rescaled to sum to 1.0. Weights already summing to 1.0 come back unchanged.
     */
    public ScoringWeights normalized() {
        double total = total();
        if (total <= 0 || Math.abs(total - 1.0) < 1e-9) {
            return this;
        }
        return ScoringWeights.builder()
                .emailQuality(emailQuality / total)
                .companyRelevance(companyRelevance / total)
                .geographicPriority(geographicPriority / total)
                .engagement(engagement / total)
                .build();
    }
}
