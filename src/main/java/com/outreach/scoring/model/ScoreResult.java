package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Deterministic output of scoring one record under one configuration.
 */
@Value
@Builder
@Schema(description = "Composite score, tier and explanation for one record")
public class ScoreResult {

    @Schema(example = "sales@idraulica-rossi.it")
    String identifier;

    RecordStatus status;

    @Schema(description = "Final score after bonuses and penalties", example = "112.32")
    double compositeScore;

    @Schema(description = "Weighted composite before adjustments, 0-100", example = "72.0")
    double weightedScore;

    PriorityTier tier;

    List<DimensionScore> breakdown;

    List<ScoreAdjustment> adjustments;

    List<KeywordMatch> keywordMatches;

    GeoMatch geoMatch;

    DomainClass domainClass;

    AnomalyReport anomaly;

    @Schema(description = "Why the record could not be scored (INVALID_RECORD only)")
    String error;

    public static ScoreResult invalid(String identifier, String error) {
        return ScoreResult.builder()
                .identifier(identifier)
                .status(RecordStatus.INVALID_RECORD)
                .compositeScore(0.0)
                .weightedScore(0.0)
                .tier(PriorityTier.EXCLUDED)
                .breakdown(List.of())
                .adjustments(List.of())
                .keywordMatches(List.of())
                .error(error)
                .build();
    }
}
