package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Schema(description = "Email quality rules: domain lists, structure checks and suspicious patterns")
public class EmailQualityRules {

    @JsonProperty("corporate_domains")
    @Schema(description = "Require corporate domains; free-mail addresses are penalized when true")
    boolean corporateDomains;

    @JsonProperty("structure_quality")
    @Schema(description = "Blend the structural score of the address into the quality dimension")
    boolean structureQuality;

    @JsonProperty("free_email_penalty")
    @Schema(description = "Penalty fraction for free-mail domains, in [-1, 0]", example = "-0.5")
    double freeEmailPenalty;

    @JsonProperty("suspicious_patterns")
    @Schema(description = "Regular expressions evaluated against the full address", example = "[\"no-?reply\"]")
    List<String> suspiciousPatterns;

    @JsonProperty("free_domains")
    List<String> freeDomains;

    @JsonProperty("disposable_domains")
    List<String> disposableDomains;

    @JsonProperty("suspicious_domains")
    List<String> suspiciousDomains;

    @JsonProperty("corporate_domain_list")
    List<String> corporateDomainList;

    @JsonProperty("risky_domain_penalty")
    @Schema(description = "Multiplier applied when the domain is disposable or suspicious", example = "0.5")
    double riskyDomainPenalty;

    @JsonProperty("anomaly_penalties")
    AnomalyPenalties anomalyPenalties;
}
