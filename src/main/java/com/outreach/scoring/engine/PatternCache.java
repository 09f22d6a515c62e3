package com.outreach.scoring.engine;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Compiled, case-insensitive regular expressions keyed by source text.
 * Configurations are validated before use, so every pattern seen here compiles.
 */
@Component
public class PatternCache {

    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    public Pattern get(String regex) {
        return patterns.computeIfAbsent(regex, r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE));
    }

    public int size() {
        return patterns.size();
    }
}
