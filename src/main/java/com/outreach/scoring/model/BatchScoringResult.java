package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@Schema(description = "Results of scoring a batch of records, in input order, with tier counts")
public class BatchScoringResult {

    @Schema(description = "Fingerprint of the configuration used")
    String configFingerprint;

    int total;

    @Schema(description = "Records per tier; sums to total", example = "{\"HIGH\": 3, \"MEDIUM\": 10, \"LOW\": 5, \"EXCLUDED\": 2}")
    Map<PriorityTier, Long> tierCounts;

    @Schema(description = "Records that could not be scored (counted as EXCLUDED)")
    long invalidCount;

    @Schema(description = "Results served from the score cache")
    long cacheHits;

    double averageScore;

    double minScore;

    double maxScore;

    List<ScoreResult> results;
}
