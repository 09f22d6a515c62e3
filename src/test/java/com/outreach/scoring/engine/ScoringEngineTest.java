package com.outreach.scoring.engine;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.outreach.scoring.model.AdjustmentKind;
import com.outreach.scoring.model.AnomalyType;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.DimensionScore;
import com.outreach.scoring.model.PriorityTier;
import com.outreach.scoring.model.RecordStatus;
import com.outreach.scoring.model.ScoreAdjustment;
import com.outreach.scoring.model.ScoreResult;
import com.outreach.scoring.model.ScoringDimension;
import com.outreach.scoring.model.Severity;
import com.outreach.scoring.model.config.RuleConfiguration;
import com.outreach.scoring.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScoringEngineTest {

    private ScoringEngine engine;
    private RuleConfiguration config;

    @BeforeEach
    void setUp() {
        engine = TestDataFactory.scoringEngine();
        config = TestDataFactory.configuration();
    }

    @Test
    void score_corporateTargetRecord_highWithGeographyBonus() {
        ScoreResult result = engine.score(TestDataFactory.createRecord("sales@rossi-srl.it"), config);

        // (100 + 40 + 98 + 80) / 4 = 79.5, then x1.4 target-country bonus
        assertThat(result.getStatus()).isEqualTo(RecordStatus.SCORED);
        assertThat(result.getWeightedScore()).isCloseTo(79.5, within(0.01));
        assertThat(result.getCompositeScore()).isCloseTo(111.3, within(0.01));
        assertThat(result.getTier()).isEqualTo(PriorityTier.HIGH);
        assertThat(result.getAdjustments()).singleElement().satisfies(a -> {
            assertThat(a.getName()).isEqualTo("targetGeography");
            assertThat(a.getKind()).isEqualTo(AdjustmentKind.BONUS);
            assertThat(a.getMultiplier()).isEqualTo(1.4);
        });
        assertThat(result.getBreakdown()).hasSize(4)
                .allSatisfy(d -> assertThat(d.getWeight()).isEqualTo(0.25));
        assertThat(result.getAnomaly().getSeverity()).isEqualTo(Severity.NONE);
    }

    @Test
    void score_sameInputs_sameResult() {
        ContactRecord record = TestDataFactory.createRecord("sales@rossi-srl.it");

        assertThat(engine.score(record, config)).isEqualTo(engine.score(record, config));
    }

    @Test
    void score_weightsRescaled_sameScore() {
        ObjectNode document = TestDataFactory.configDocument();
        ((ObjectNode) document.path("scoring").path("weights"))
                .put("email_quality", 3).put("company_relevance", 3)
                .put("geographic_priority", 3).put("engagement", 3);
        RuleConfiguration scaled = TestDataFactory.configuration(document);
        ContactRecord record = TestDataFactory.createRecord("sales@rossi-srl.it");

        assertThat(engine.score(record, scaled).getCompositeScore())
                .isEqualTo(engine.score(record, config).getCompositeScore());
    }

    @Test
    void score_breakdownSumsToWeightedScore() {
        ScoreResult result = engine.score(TestDataFactory.createRecord("mario@gmail.com", "Valves Retail", "Germany"),
                config);

        double sum = result.getBreakdown().stream().mapToDouble(DimensionScore::getWeightedScore).sum();
        assertThat(result.getWeightedScore()).isCloseTo(sum, within(0.01));
    }

    @Test
    void score_neverBelowFloor() {
        ObjectNode document = TestDataFactory.configDocument();
        ((ObjectNode) document.path("scoring").path("thresholds")).put("score_floor", 20);
        RuleConfiguration floored = TestDataFactory.configuration(document);
        ContactRecord record = TestDataFactory.createRecord("x1234567@mailinator.com", "Bakery", "France");

        ScoreResult result = engine.score(record, floored);

        // 18.75 weighted, x0.5 risky domain, x0.6 high anomaly
        assertThat(result.getWeightedScore()).isCloseTo(18.75, within(0.01));
        assertThat(result.getAdjustments()).extracting(ScoreAdjustment::getName)
                .containsExactly("riskyDomain", "anomaly");
        assertThat(result.getCompositeScore()).isEqualTo(20.0);
        assertThat(result.getTier()).isEqualTo(PriorityTier.EXCLUDED);
    }

    @Test
    void score_addingPositiveKeyword_neverLowersScore() {
        ContactRecord plain = TestDataFactory.createRecord("info@company.it", "Rossi Srl", "Italy");
        ContactRecord relevant = TestDataFactory.createRecord("info@company.it", "Rossi Hydraulic Srl", "Italy");

        assertThat(engine.score(relevant, config).getCompositeScore())
                .isGreaterThan(engine.score(plain, config).getCompositeScore());
    }

    @Test
    void score_raisingPositiveKeywordWeight_neverLowersRelevance() {
        ContactRecord hydraulicOnly = TestDataFactory.createRecord("info@rossi-srl.it", "Rossi Hydraulic Systems Srl", "Italy");
        ContactRecord overlapping = TestDataFactory.createRecord("info@rossi-srl.it", "Rossi Hydraulic Pump Srl", "Italy");
        double previousOnly = -1;
        double previousOverlapping = -1;

        for (double weight : new double[]{0.5, 1.0, 2.0, 3.5, 5.0, 7.5, 10.0}) {
            ObjectNode document = TestDataFactory.configDocument();
            ((ObjectNode) document.at("/company_keywords/primary_keywords/positive/1")).put("weight", weight);
            RuleConfiguration raised = TestDataFactory.configuration(document);

            double relevanceOnly = relevance(engine.score(hydraulicOnly, raised));
            double relevanceOverlapping = relevance(engine.score(overlapping, raised));

            assertThat(relevanceOnly).as("weight %s", weight).isGreaterThanOrEqualTo(previousOnly);
            assertThat(relevanceOverlapping).as("weight %s", weight).isGreaterThanOrEqualTo(previousOverlapping);
            previousOnly = relevanceOnly;
            previousOverlapping = relevanceOverlapping;
        }
        assertThat(previousOnly).isEqualTo(100.0);
    }

    @Test
    void score_tierMatchesThresholds() {
        for (ContactRecord record : TestDataFactory.createRecords(12)) {
            ScoreResult result = engine.score(record, config);
            assertThat(result.getTier())
                    .isEqualTo(PriorityTier.fromScore(result.getCompositeScore(), config.getScoring().getThresholds()));
        }
    }

    @Test
    void score_malformedRecord_invalidInsteadOfThrowing() {
        ScoreResult result = engine.score(TestDataFactory.createRecord("not-an-email"), config);

        assertThat(result.getStatus()).isEqualTo(RecordStatus.INVALID_RECORD);
        assertThat(result.getCompositeScore()).isEqualTo(0.0);
        assertThat(result.getTier()).isEqualTo(PriorityTier.EXCLUDED);
        assertThat(result.getError()).isEqualTo("email address must contain exactly one '@'");
        assertThat(result.getIdentifier()).isEqualTo("not-an-email");
    }

    @Test
    void score_spamTrapRecord_excludedDespiteHighScore() {
        ScoreResult result = engine.score(TestDataFactory.createRecord("test@rossi-srl.it"), config);

        assertThat(result.getCompositeScore()).isGreaterThanOrEqualTo(70.0);
        assertThat(result.getAnomaly().getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(result.getAnomaly().getType()).isEqualTo(AnomalyType.SPAM_TRAP);
        assertThat(result.getTier()).isEqualTo(PriorityTier.EXCLUDED);
    }

    @Test
    void score_domainRulesAppliedBeforeGeographyBonus() {
        ObjectNode document = TestDataFactory.configDocument();
        ObjectNode rule = document.putObject("domain_rules").putObject("italian_tld");
        rule.putArray("keywords").add(".it");
        rule.put("multiplier", 1.1);
        rule.put("scope", "domain");
        RuleConfiguration withRules = TestDataFactory.configuration(document);

        ScoreResult result = engine.score(TestDataFactory.createRecord("sales@rossi-srl.it"), withRules);

        assertThat(result.getAdjustments()).extracting(ScoreAdjustment::getName)
                .containsExactly("italian_tld", "targetGeography");
        assertThat(result.getCompositeScore()).isCloseTo(79.5 * 1.1 * 1.4, within(0.01));
    }

    private static double relevance(ScoreResult result) {
        return result.getBreakdown().stream()
                .filter(d -> d.getDimension() == ScoringDimension.RELEVANCE)
                .mapToDouble(DimensionScore::getRawScore)
                .findFirst()
                .orElseThrow();
    }
}
