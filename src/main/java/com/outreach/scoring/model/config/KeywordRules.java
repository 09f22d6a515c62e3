package com.outreach.scoring.model.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class KeywordRules {

    @JsonProperty("primary_keywords")
    KeywordSet primaryKeywords;

    @JsonProperty("secondary_keywords")
    KeywordSet secondaryKeywords;
}
