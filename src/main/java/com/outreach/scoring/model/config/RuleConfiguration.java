package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

/**
 * Validated, immutable rule set used to score contact records.
 * Instances only come out of the configuration validator; {@link #getFingerprint()}
 * identifies the content and versions the configuration for caching.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"metadata", "target", "scoring", "company_keywords", "geographic_rules",
        "email_quality", "domain_rules"})
@Schema(description = "Validated rule configuration used to score contact records")
public class RuleConfiguration {

    ConfigMetadata metadata;

    TargetProfile target;

    ScoringRules scoring;

    @JsonProperty("company_keywords")
    KeywordRules companyKeywords;

    @JsonProperty("geographic_rules")
    GeographicRules geographicRules;

    @JsonProperty("email_quality")
    EmailQualityRules emailQuality;

    @JsonProperty("domain_rules")
    DomainRules domainRules;

    @JsonIgnore
    @Schema(hidden = true)
    String fingerprint;
}
