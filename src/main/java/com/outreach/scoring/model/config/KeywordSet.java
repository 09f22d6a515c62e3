package com.outreach.scoring.model.config;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class KeywordSet {

    @Builder.Default
    List<KeywordTerm> positive = List.of();

    @Builder.Default
    List<KeywordTerm> negative = List.of();

    public static KeywordSet empty() {
        return KeywordSet.builder().build();
    }
}
