package com.outreach.scoring.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Normalized per-dimension signals for one record, plus the matches that produced them.
 */
@Value
@Builder
@Schema(description = "Signals extracted from one record under one configuration")
public class FeatureSet {

    String identifier;

    String localPart;

    String domain;

    DomainClass domainClass;

    @Schema(description = "Quality dimension, 0-100")
    double quality;

    @Schema(description = "Relevance dimension, 0-100")
    double relevance;

    @Schema(description = "Geography dimension, 0-100")
    double geography;

    @Schema(description = "Engagement dimension, 0-100")
    double engagement;

    @Schema(description = "Structural soundness of the address, 0-100")
    double structuralScore;

    List<KeywordMatch> keywordMatches;

    GeoMatch geoMatch;

    @Schema(description = "Configured suspicious patterns that matched the address")
    List<String> qualityFlags;

    @Schema(description = "Names of domain rules whose keywords matched")
    List<String> matchedDomainRules;

    public double valueOf(ScoringDimension dimension) {
        return switch (dimension) {
            case QUALITY -> quality;
            case RELEVANCE -> relevance;
            case GEOGRAPHY -> geography;
            case ENGAGEMENT -> engagement;
        };
    }
}
