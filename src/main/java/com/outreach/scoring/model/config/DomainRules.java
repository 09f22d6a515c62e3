package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Named multiplicative adjustment rules, kept in configuration order.
 */
@Value
@Builder(toBuilder = true)
public class DomainRules {

    @Singular
    Map<String, DomainRule> rules;

    @JsonAnyGetter
    public Map<String, DomainRule> getRules() {
        return rules;
    }

    public static DomainRules empty() {
        return DomainRules.builder().build();
    }
}
