package com.outreach.scoring.engine;

import com.outreach.scoring.engine.anomaly.AnomalyClassifier;
import com.outreach.scoring.exception.InvalidRecordException;
import com.outreach.scoring.model.AdjustmentKind;
import com.outreach.scoring.model.AnomalyReport;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.DimensionScore;
import com.outreach.scoring.model.DomainClass;
import com.outreach.scoring.model.FeatureSet;
import com.outreach.scoring.model.GeoMatch;
import com.outreach.scoring.model.GeoMatchLevel;
import com.outreach.scoring.model.PriorityTier;
import com.outreach.scoring.model.RecordStatus;
import com.outreach.scoring.model.ScoreAdjustment;
import com.outreach.scoring.model.ScoreResult;
import com.outreach.scoring.model.ScoringDimension;
import com.outreach.scoring.model.Severity;
import com.outreach.scoring.model.config.AnomalyPenalties;
import com.outreach.scoring.model.config.DomainRule;
import com.outreach.scoring.model.config.EmailQualityRules;
import com.outreach.scoring.model.config.PriorityThresholds;
import com.outreach.scoring.model.config.RuleConfiguration;
import com.outreach.scoring.model.config.ScoringWeights;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Combines a record's features into a composite score and priority tier.
 *
 * composite = Σ(dimension × normalized weight), in [0, 100]
 * final     = max(scoreFloor, composite × Π(bonus and penalty multipliers))
 *
 * Bonuses are not capped, so the final score may exceed 100. A CRITICAL anomaly forces EXCLUDED.
 * Pure: the same record and configuration always produce the same result.
 */
@Component
public class ScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    private final FeatureExtractor featureExtractor;
    private final AnomalyClassifier anomalyClassifier;

    public ScoringEngine(FeatureExtractor featureExtractor, AnomalyClassifier anomalyClassifier) {
        this.featureExtractor = featureExtractor;
        this.anomalyClassifier = anomalyClassifier;
    }

    /**
     * Score one record. Records that cannot be processed come back as INVALID_RECORD
     * with score 0 and tier EXCLUDED instead of throwing.
     */
    public ScoreResult score(ContactRecord record, RuleConfiguration config) {
        String identifier = record == null ? null : record.getEmail();
        FeatureSet features;
        try {
            features = featureExtractor.extract(record, config);
        } catch (InvalidRecordException e) {
            log.warn("Invalid record {}: {}", identifier, e.getMessage());
            return ScoreResult.invalid(identifier, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Feature extraction failed for record {}: {}", identifier, e.getMessage(), e);
            return ScoreResult.invalid(identifier, "feature extraction failed: " + e.getMessage());
        }

        AnomalyReport anomaly = anomalyClassifier.classify(record, features.getQualityFlags());

        List<DimensionScore> breakdown = breakdown(features, config.getScoring().getWeights());
        double weighted = breakdown.stream().mapToDouble(DimensionScore::getWeightedScore).sum();

        List<ScoreAdjustment> adjustments = adjustments(features, anomaly, config);
        double adjusted = weighted;
        for (ScoreAdjustment adjustment : adjustments) {
            adjusted *= adjustment.getMultiplier();
        }

        PriorityThresholds thresholds = config.getScoring().getThresholds();
        double finalScore = round(Math.max(thresholds.getScoreFloor(), Math.max(0.0, adjusted)));

        PriorityTier tier = anomaly.getSeverity() == Severity.CRITICAL
                ? PriorityTier.EXCLUDED
                : PriorityTier.fromScore(finalScore, thresholds);

        log.debug("Scored {}: weighted={}, final={}, tier={}, adjustments={}",
                features.getIdentifier(), round(weighted), finalScore, tier, adjustments.size());

        return ScoreResult.builder()
                .identifier(features.getIdentifier())
                .status(RecordStatus.SCORED)
                .compositeScore(finalScore)
                .weightedScore(round(weighted))
                .tier(tier)
                .breakdown(breakdown)
                .adjustments(adjustments)
                .keywordMatches(features.getKeywordMatches())
                .geoMatch(features.getGeoMatch())
                .domainClass(features.getDomainClass())
                .anomaly(anomaly)
                .build();
    }

    private List<DimensionScore> breakdown(FeatureSet features, ScoringWeights configured) {
        ScoringWeights weights = configured.normalized();
        List<DimensionScore> breakdown = new ArrayList<>();
        for (ScoringDimension dimension : ScoringDimension.values()) {
            double raw = features.valueOf(dimension);
            double weight = weightOf(weights, dimension);
            breakdown.add(DimensionScore.builder()
                    .dimension(dimension)
                    .rawScore(round(raw))
                    .weight(weight)
                    .weightedScore(raw * weight)
                    .build());
        }
        return breakdown;
    }

    private static double weightOf(ScoringWeights weights, ScoringDimension dimension) {
        return switch (dimension) {
            case QUALITY -> weights.getEmailQuality();
            case RELEVANCE -> weights.getCompanyRelevance();
            case GEOGRAPHY -> weights.getGeographicPriority();
            case ENGAGEMENT -> weights.getEngagement();
        };
    }

    /**
     * Multiplicative adjustments in a fixed order: domain rules (configuration order),
     * target geography, risky domain, anomaly penalty. Neutral multipliers (1.0) are omitted.
     */
    private List<ScoreAdjustment> adjustments(FeatureSet features, AnomalyReport anomaly, RuleConfiguration config) {
        List<ScoreAdjustment> adjustments = new ArrayList<>();

        for (String name : features.getMatchedDomainRules()) {
            DomainRule rule = config.getDomainRules().getRules().get(name);
            if (rule != null && rule.getMultiplier() != 1.0) {
                adjustments.add(adjustment(name, rule.getMultiplier(),
                        "Keyword rule '" + name + "' matched in " + rule.getScope().wireName()));
            }
        }

        GeoMatch geo = features.getGeoMatch();
        if (geo.isTargetCountry() && geo.getLevel() == GeoMatchLevel.COUNTRY && geo.getMultiplier() > 1.0) {
            adjustments.add(adjustment("targetGeography", geo.getMultiplier(),
                    "Record is in target country " + geo.getMatchedKey()));
        }

        EmailQualityRules quality = config.getEmailQuality();
        DomainClass domainClass = features.getDomainClass();
        if ((domainClass == DomainClass.DISPOSABLE || domainClass == DomainClass.SUSPICIOUS)
                && quality.getRiskyDomainPenalty() < 1.0) {
            adjustments.add(adjustment("riskyDomain", quality.getRiskyDomainPenalty(),
                    "Domain " + features.getDomain() + " is classified " + domainClass));
        }

        double anomalyMultiplier = anomalyMultiplier(anomaly.getSeverity(), quality.getAnomalyPenalties());
        if (anomalyMultiplier != 1.0) {
            adjustments.add(adjustment("anomaly", anomalyMultiplier,
                    anomaly.getSeverity() + " " + anomaly.getType() + " anomaly"));
        }
        return adjustments;
    }

    private static double anomalyMultiplier(Severity severity, AnomalyPenalties penalties) {
        AnomalyPenalties p = penalties == null ? AnomalyPenalties.defaults() : penalties;
        return switch (severity) {
            case LOW -> p.getLow();
            case MEDIUM -> p.getMedium();
            case HIGH -> p.getHigh();
            // CRITICAL is handled by forcing the tier; NONE has no effect
            default -> 1.0;
        };
    }

    private static ScoreAdjustment adjustment(String name, double multiplier, String reason) {
        return ScoreAdjustment.builder()
                .name(name)
                .kind(multiplier > 1.0 ? AdjustmentKind.BONUS : AdjustmentKind.PENALTY)
                .multiplier(multiplier)
                .reason(reason)
                .build();
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
