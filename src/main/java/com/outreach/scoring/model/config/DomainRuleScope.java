package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DomainRuleScope {
    TEXT,
    DOMAIN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    public static DomainRuleScope fromWireName(String value) {
        for (DomainRuleScope scope : values()) {
            if (scope.wireName().equals(value)) {
                return scope;
            }
        }
        return null;
    }
}
