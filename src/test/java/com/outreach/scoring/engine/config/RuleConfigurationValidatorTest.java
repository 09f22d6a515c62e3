package com.outreach.scoring.engine.config;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.outreach.scoring.exception.SchemaException;
import com.outreach.scoring.exception.SchemaViolation;
import com.outreach.scoring.model.config.DomainRuleScope;
import com.outreach.scoring.model.config.RuleConfiguration;
import com.outreach.scoring.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.outreach.scoring.testutil.TestDataFactory.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RuleConfigurationValidatorTest {

    private RuleConfigurationValidator validator;
    private ConfigurationCodec codec;
    private ObjectNode document;

    @BeforeEach
    void setUp() {
        codec = TestDataFactory.codec();
        validator = new RuleConfigurationValidator(codec);
        document = TestDataFactory.configDocument();
    }

    @Test
    void validate_fixture_buildsConfigurationWithDefaults() {
        RuleConfiguration config = validator.validate(document);

        assertThat(config.getMetadata().getName()).isEqualTo("Test Hydraulics");
        assertThat(config.getTarget().getCountry()).isEqualTo("Italy");
        assertThat(config.getScoring().getThresholds().getHighPriority()).isEqualTo(70.0);
        assertThat(config.getCompanyKeywords().getPrimaryKeywords().getPositive()).hasSize(2);
        assertThat(config.getCompanyKeywords().getSecondaryKeywords().getPositive().get(0).getWeight())
                .isEqualTo(1.0);
        assertThat(config.getGeographicRules().getMultipliers()).containsEntry("Italy", 1.4);
        assertThat(config.getEmailQuality().getFreeDomains()).contains("gmail.com");
        assertThat(config.getEmailQuality().getRiskyDomainPenalty()).isEqualTo(0.5);
        assertThat(config.getEmailQuality().getAnomalyPenalties().getHigh()).isEqualTo(0.6);
        assertThat(config.getDomainRules().getRules()).isEmpty();
        assertThat(config.getFingerprint()).hasSize(64);
    }

    @Test
    void validate_unknownTopLevelField_rejected() {
        document.put("weights", 1);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).containsExactly(new SchemaViolation("weights", "unknown field"));
    }

    @Test
    void validate_unknownNestedField_reportsDottedPath() {
        ((ObjectNode) document.path("scoring").path("weights")).put("speed", 0.5);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getPath()).isEqualTo("scoring.weights.speed");
        assertThat(e.getReason()).isEqualTo("unknown field");
    }

    @Test
    void validate_thresholdsOutOfOrder_rejected() {
        ((ObjectNode) document.path("scoring").path("thresholds")).put("medium_priority", 80);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getPath()).isEqualTo("scoring.thresholds");
        assertThat(e.getReason()).isEqualTo("must satisfy high_priority > medium_priority > low_priority");
    }

    @Test
    void validate_thresholdOutOfRange_reportsValue() {
        ((ObjectNode) document.path("scoring").path("thresholds")).put("high_priority", 250);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).contains(
                new SchemaViolation("scoring.thresholds.high_priority", "must be in [0, 200] (got 250)"));
    }

    @Test
    void validate_scoreFloorNotBelowLow_rejected() {
        ((ObjectNode) document.path("scoring").path("thresholds")).put("score_floor", 30);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).containsExactly(
                new SchemaViolation("scoring.thresholds.score_floor", "must be below low_priority"));
    }

    @Test
    void validate_allWeightsZero_rejected() {
        ObjectNode weights = (ObjectNode) document.path("scoring").path("weights");
        weights.put("email_quality", 0).put("company_relevance", 0).put("geographic_priority", 0).put("engagement", 0);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).containsExactly(
                new SchemaViolation("scoring.weights", "at least one weight must be positive"));
    }

    @Test
    void validate_collectsEveryViolation() {
        document.remove("target");
        ((ObjectNode) document.path("metadata")).put("version", "v1");
        ((ObjectNode) document.path("email_quality")).putArray("suspicious_patterns").add("[unclosed");

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).extracting(SchemaViolation::path)
                .containsExactlyInAnyOrder("metadata.version", "target", "email_quality.suspicious_patterns[0]");
        assertThat(e.getViolations()).anySatisfy(v -> {
            assertThat(v.path()).isEqualTo("email_quality.suspicious_patterns[0]");
            assertThat(v.reason()).startsWith("invalid regular expression");
        });
        assertThat(e.getViolations()).contains(new SchemaViolation("target", "required section missing"));
    }

    @Test
    void validate_zeroKeywordWeight_rejected() {
        ObjectNode term = (ObjectNode) document.path("company_keywords").path("primary_keywords")
                .path("negative").get(0);
        term.put("weight", 0);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).containsExactly(new SchemaViolation(
                "company_keywords.primary_keywords.negative[0].weight", "must be in (0, 10] (got 0)"));
    }

    @Test
    void validate_signedNegativeKeywordWeight_rejected() {
        ObjectNode term = (ObjectNode) document.path("company_keywords").path("primary_keywords")
                .path("negative").get(0);
        term.put("weight", -4);

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).containsExactly(new SchemaViolation(
                "company_keywords.primary_keywords.negative[0].weight", "must be in (0, 10] (got -4)"));
    }

    @Test
    void validate_primaryKeywordAsPlainString_rejected() {
        ((ObjectNode) document.path("company_keywords").path("primary_keywords"))
                .putArray("positive").add("hydraulic");

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getPath()).isEqualTo("company_keywords.primary_keywords.positive[0]");
    }

    @Test
    void validate_domainRules_parsedWithScope() {
        ObjectNode rule = document.putObject("domain_rules").putObject("italian_tld");
        rule.putArray("keywords").add(".it");
        rule.put("multiplier", 1.1);
        rule.put("scope", "domain");

        RuleConfiguration config = validator.validate(document);

        assertThat(config.getDomainRules().getRules()).containsKey("italian_tld");
        assertThat(config.getDomainRules().getRules().get("italian_tld").getScope()).isEqualTo(DomainRuleScope.DOMAIN);
    }

    @Test
    void validate_domainRuleWithUnknownScope_rejected() {
        ObjectNode rule = document.putObject("domain_rules").putObject("italian_tld");
        rule.putArray("keywords").add(".it");
        rule.put("multiplier", 1.1);
        rule.put("scope", "everywhere");

        SchemaException e = catchThrowableOfType(() -> validator.validate(document), SchemaException.class);

        assertThat(e.getViolations()).containsExactly(
                new SchemaViolation("domain_rules.italian_tld.scope", "must be one of text, domain"));
    }

    @Test
    void validate_nonObjectDocument_rejectedAtRoot() throws Exception {
        assertThatThrownBy(() -> validator.validate(MAPPER.readTree("[1, 2]")))
                .isInstanceOf(SchemaException.class)
                .hasMessage("$: configuration must be a JSON object");
    }

    @Test
    void validate_malformedJson_rejectedAtRoot() {
        SchemaException e = catchThrowableOfType(() -> validator.validate("{\"metadata\": "), SchemaException.class);

        assertThat(e.getPath()).isEqualTo("$");
        assertThat(e.getReason()).startsWith("malformed JSON");
    }

    @Test
    void serialize_thenValidate_roundTripsToSameFingerprint() {
        RuleConfiguration config = validator.validate(document);

        RuleConfiguration reparsed = validator.validate(codec.toJson(config));

        assertThat(reparsed).isEqualTo(config);
        assertThat(reparsed.getFingerprint()).isEqualTo(config.getFingerprint());
    }

    @Test
    void fingerprint_changesWithContent_notWithKeyOrder() {
        RuleConfiguration original = validator.validate(document);

        ObjectNode reordered = MAPPER.createObjectNode();
        reordered.set("email_quality", document.get("email_quality"));
        reordered.set("geographic_rules", document.get("geographic_rules"));
        reordered.set("company_keywords", document.get("company_keywords"));
        reordered.set("scoring", document.get("scoring"));
        reordered.set("target", document.get("target"));
        reordered.set("metadata", document.get("metadata"));
        assertThat(validator.validate(reordered).getFingerprint()).isEqualTo(original.getFingerprint());

        ((ObjectNode) document.path("scoring").path("thresholds")).put("high_priority", 75);
        assertThat(validator.validate(document).getFingerprint()).isNotEqualTo(original.getFingerprint());
    }
}
