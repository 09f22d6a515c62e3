package com.outreach.scoring.engine.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.outreach.scoring.exception.SchemaException;
import com.outreach.scoring.exception.SchemaViolation;
import com.outreach.scoring.model.config.AnomalyPenalties;
import com.outreach.scoring.model.config.ConfigMetadata;
import com.outreach.scoring.model.config.DomainRule;
import com.outreach.scoring.model.config.DomainRuleScope;
import com.outreach.scoring.model.config.DomainRules;
import com.outreach.scoring.model.config.EmailQualityRules;
import com.outreach.scoring.model.config.GeographicRules;
import com.outreach.scoring.model.config.KeywordRules;
import com.outreach.scoring.model.config.KeywordSet;
import com.outreach.scoring.model.config.KeywordTerm;
import com.outreach.scoring.model.config.PriorityThresholds;
import com.outreach.scoring.model.config.RuleConfiguration;
import com.outreach.scoring.model.config.ScoringRules;
import com.outreach.scoring.model.config.ScoringWeights;
import com.outreach.scoring.model.config.TargetProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Turns a raw configuration document into an immutable {@link RuleConfiguration}.
 *
 * Every section has an explicit key whitelist: unknown keys are violations, not ignored.
 * All violations in the document are collected and reported together, each qualified by
 * the dotted path of the offending field (e.g. {@code scoring.thresholds.high_priority}).
 * Optional fields are filled with their defaults so the result serializes to a complete document.
 */
@Component
public class RuleConfigurationValidator {

    private static final Logger log = LoggerFactory.getLogger(RuleConfigurationValidator.class);

    private static final Pattern VERSION = Pattern.compile("^\\d+\\.\\d+$");

    private static final Set<String> TOP_LEVEL_KEYS = Set.of("metadata", "target", "scoring",
            "company_keywords", "geographic_rules", "email_quality", "domain_rules");
    private static final Set<String> METADATA_KEYS = Set.of("id", "name", "description", "version",
            "author", "created", "updated");
    private static final Set<String> TARGET_KEYS = Set.of("country", "industry", "languages");
    private static final Set<String> SCORING_KEYS = Set.of("weights", "thresholds");
    private static final Set<String> WEIGHT_KEYS = Set.of("email_quality", "company_relevance",
            "geographic_priority", "engagement");
    private static final Set<String> THRESHOLD_KEYS = Set.of("high_priority", "medium_priority",
            "low_priority", "score_floor");
    private static final Set<String> KEYWORD_KEYS = Set.of("primary_keywords", "secondary_keywords");
    private static final Set<String> KEYWORD_SET_KEYS = Set.of("positive", "negative");
    private static final Set<String> TERM_KEYS = Set.of("term", "weight");
    private static final Set<String> GEOGRAPHY_KEYS = Set.of("target_regions", "exclude_regions",
            "multipliers", "region_members");
    private static final Set<String> EMAIL_QUALITY_KEYS = Set.of("corporate_domains", "structure_quality",
            "free_email_penalty", "suspicious_patterns", "free_domains", "disposable_domains",
            "suspicious_domains", "corporate_domain_list", "risky_domain_penalty", "anomaly_penalties");
    private static final Set<String> PENALTY_KEYS = Set.of("low", "medium", "high");
    private static final Set<String> DOMAIN_RULE_KEYS = Set.of("keywords", "multiplier", "scope");

    static final double DEFAULT_FREE_EMAIL_PENALTY = -0.5;
    static final double DEFAULT_RISKY_DOMAIN_PENALTY = 0.5;

    private static final Range NON_NEGATIVE = Range.closed(0, Double.MAX_VALUE);
    private static final Range THRESHOLD = Range.closed(0, 200);
    // Negative terms carry their penalty in the tier's points, so every weight is a positive magnitude.
    private static final Range KEYWORD_WEIGHT = Range.openClosed(0, 10);
    private static final Range GEO_MULTIPLIER = Range.openClosed(0, 5);
    private static final Range RULE_MULTIPLIER = Range.closed(0.1, 3);
    private static final Range FREE_EMAIL_PENALTY = Range.closed(-1, 0);
    private static final Range PENALTY_MULTIPLIER = Range.openClosed(0, 1);

    private final ConfigurationCodec codec;

    public RuleConfigurationValidator(ConfigurationCodec codec) {
        this.codec = codec;
    }

    public RuleConfiguration validate(String document) {
        return validate(codec.parse(document));
    }

    /**
     * Validates a parsed document.
     *
     * @throws SchemaException listing every violation; nothing is constructed in that case
     */
    public RuleConfiguration validate(JsonNode raw) {
        if (raw == null || !raw.isObject()) {
            throw new SchemaException("$", "configuration must be a JSON object");
        }

        List<SchemaViolation> violations = new ArrayList<>();
        Section root = new Section("", raw, violations, TOP_LEVEL_KEYS);

        ConfigMetadata metadata = root.section("metadata", true, METADATA_KEYS)
                .map(this::readMetadata).orElse(null);
        TargetProfile target = root.section("target", true, TARGET_KEYS)
                .map(this::readTarget).orElse(null);
        ScoringRules scoring = root.section("scoring", true, SCORING_KEYS)
                .map(this::readScoring).orElse(null);
        KeywordRules keywords = root.section("company_keywords", true, KEYWORD_KEYS)
                .map(this::readKeywords).orElse(null);
        GeographicRules geography = root.section("geographic_rules", true, GEOGRAPHY_KEYS)
                .map(this::readGeography).orElse(null);
        EmailQualityRules emailQuality = root.section("email_quality", true, EMAIL_QUALITY_KEYS)
                .map(this::readEmailQuality).orElse(null);
        DomainRules domainRules = root.section("domain_rules", false, null)
                .map(this::readDomainRules).orElse(DomainRules.empty());

        if (!violations.isEmpty()) {
            log.debug("Configuration rejected with {} violation(s): {}", violations.size(), violations);
            throw new SchemaException(violations);
        }

        RuleConfiguration config = RuleConfiguration.builder()
                .metadata(metadata)
                .target(target)
                .scoring(scoring)
                .companyKeywords(keywords)
                .geographicRules(geography)
                .emailQuality(emailQuality)
                .domainRules(domainRules)
                .build();
        return config.toBuilder().fingerprint(codec.fingerprint(config)).build();
    }

    private ConfigMetadata readMetadata(Section s) {
        String version = s.string("version", true, 1, 20);
        if (version != null && !VERSION.matcher(version).matches()) {
            s.reject("version", "must be major.minor, e.g. 1.0");
        }
        return ConfigMetadata.builder()
                .id(s.string("id", false, 1, 100))
                .name(s.string("name", true, 1, 100))
                .description(s.string("description", false, 0, 500))
                .version(version)
                .author(s.string("author", false, 0, 100))
                .created(s.string("created", false, 0, 50))
                .updated(s.string("updated", false, 0, 50))
                .build();
    }

    private TargetProfile readTarget(Section s) {
        List<String> languages = s.strings("languages", false);
        if (languages != null && (languages.isEmpty() || languages.size() > 5)) {
            s.reject("languages", "must list 1 to 5 languages");
        }
        return TargetProfile.builder()
                .country(trim(s.string("country", true, 1, 100)))
                .industry(trim(s.string("industry", true, 1, 100)))
                .languages(languages)
                .build();
    }

    private ScoringRules readScoring(Section s) {
        ScoringWeights weights = s.section("weights", true, WEIGHT_KEYS).map(this::readWeights).orElse(null);
        PriorityThresholds thresholds = s.section("thresholds", true, THRESHOLD_KEYS)
                .map(this::readThresholds).orElse(null);
        return ScoringRules.builder().weights(weights).thresholds(thresholds).build();
    }

    private ScoringWeights readWeights(Section s) {
        ScoringWeights weights = ScoringWeights.builder()
                .emailQuality(orZero(s.number("email_quality", true, NON_NEGATIVE)))
                .companyRelevance(orZero(s.number("company_relevance", true, NON_NEGATIVE)))
                .geographicPriority(orZero(s.number("geographic_priority", true, NON_NEGATIVE)))
                .engagement(orZero(s.number("engagement", true, NON_NEGATIVE)))
                .build();
        if (weights.total() <= 0) {
            s.rejectSelf("at least one weight must be positive");
        }
        return weights;
    }

    private PriorityThresholds readThresholds(Section s) {
        Double high = s.number("high_priority", true, THRESHOLD);
        Double medium = s.number("medium_priority", true, THRESHOLD);
        Double low = s.number("low_priority", true, THRESHOLD);
        Double floor = s.number("score_floor", false, NON_NEGATIVE);

        if (high != null && medium != null && low != null && !(high > medium && medium > low)) {
            s.rejectSelf("must satisfy high_priority > medium_priority > low_priority");
        }
        if (floor != null && low != null && floor >= low) {
            s.reject("score_floor", "must be below low_priority");
        }
        return PriorityThresholds.builder()
                .highPriority(orZero(high))
                .mediumPriority(orZero(medium))
                .lowPriority(orZero(low))
                .scoreFloor(orZero(floor))
                .build();
    }

    private KeywordRules readKeywords(Section s) {
        KeywordSet primary = s.section("primary_keywords", true, KEYWORD_SET_KEYS)
                .map(set -> readKeywordSet(set, false)).orElse(null);
        KeywordSet secondary = s.section("secondary_keywords", false, KEYWORD_SET_KEYS)
                .map(set -> readKeywordSet(set, true)).orElse(KeywordSet.empty());
        return KeywordRules.builder().primaryKeywords(primary).secondaryKeywords(secondary).build();
    }

    private KeywordSet readKeywordSet(Section s, boolean allowPlainStrings) {
        return KeywordSet.builder()
                .positive(readTerms(s, "positive", allowPlainStrings))
                .negative(readTerms(s, "negative", allowPlainStrings))
                .build();
    }

    // Secondary lists accept bare strings as shorthand for {term, weight: 1.0}.
    private List<KeywordTerm> readTerms(Section s, String key, boolean allowPlainStrings) {
        List<KeywordTerm> terms = new ArrayList<>();
        List<JsonNode> elements = s.array(key, false);
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            String path = s.pathOf(key) + "[" + i + "]";
            if (allowPlainStrings && element.isTextual()) {
                if (element.asText().isBlank()) {
                    s.violation(path, "must not be blank");
                } else {
                    terms.add(KeywordTerm.builder().term(element.asText().trim()).weight(1.0).build());
                }
            } else if (element.isObject()) {
                Section entry = new Section(path, element, s.violations, TERM_KEYS);
                String term = entry.string("term", true, 1, 100);
                Double weight = entry.number("weight", true, KEYWORD_WEIGHT);
                if (term != null && weight != null) {
                    terms.add(KeywordTerm.builder().term(term.trim()).weight(weight).build());
                }
            } else {
                s.violation(path, allowPlainStrings
                        ? "must be a string or an object {term, weight}"
                        : "must be an object {term, weight}");
            }
        }
        return terms;
    }

    private GeographicRules readGeography(Section s) {
        List<String> targetRegions = s.strings("target_regions", true);
        List<String> excludeRegions = s.strings("exclude_regions", false);

        Map<String, Double> multipliers = new LinkedHashMap<>();
        s.section("multipliers", true, null).ifPresent(m -> m.forEachField((name, value) -> {
            Double multiplier = m.number(name, true, GEO_MULTIPLIER);
            if (multiplier != null) {
                multipliers.put(name, multiplier);
            }
        }));

        Map<String, List<String>> regionMembers = new LinkedHashMap<>();
        s.section("region_members", false, null).ifPresent(r -> r.forEachField((region, value) -> {
            List<String> members = r.strings(region, true);
            if (members != null) {
                regionMembers.put(region, members);
            }
        }));

        return GeographicRules.builder()
                .targetRegions(targetRegions == null ? List.of() : targetRegions)
                .excludeRegions(excludeRegions == null ? List.of() : excludeRegions)
                .multipliers(Collections.unmodifiableMap(multipliers))
                .regionMembers(Collections.unmodifiableMap(regionMembers))
                .build();
    }

    private EmailQualityRules readEmailQuality(Section s) {
        List<String> patterns = s.strings("suspicious_patterns", false);
        if (patterns != null) {
            for (int i = 0; i < patterns.size(); i++) {
                try {
                    Pattern.compile(patterns.get(i));
                } catch (PatternSyntaxException e) {
                    s.violation(s.pathOf("suspicious_patterns") + "[" + i + "]",
                            "invalid regular expression: " + e.getDescription());
                }
            }
        }

        AnomalyPenalties penalties = s.section("anomaly_penalties", false, PENALTY_KEYS)
                .map(p -> AnomalyPenalties.builder()
                        .low(orDefault(p.number("low", false, PENALTY_MULTIPLIER), 1.0))
                        .medium(orDefault(p.number("medium", false, PENALTY_MULTIPLIER), 0.85))
                        .high(orDefault(p.number("high", false, PENALTY_MULTIPLIER), 0.6))
                        .build())
                .orElse(AnomalyPenalties.defaults());

        return EmailQualityRules.builder()
                .corporateDomains(Boolean.TRUE.equals(s.bool("corporate_domains", true)))
                .structureQuality(Boolean.TRUE.equals(s.bool("structure_quality", true)))
                .freeEmailPenalty(orDefault(s.number("free_email_penalty", false, FREE_EMAIL_PENALTY),
                        DEFAULT_FREE_EMAIL_PENALTY))
                .suspiciousPatterns(patterns == null ? List.of() : patterns)
                .freeDomains(domainList(s, "free_domains", DefaultDomainLists.FREE))
                .disposableDomains(domainList(s, "disposable_domains", DefaultDomainLists.DISPOSABLE))
                .suspiciousDomains(domainList(s, "suspicious_domains", DefaultDomainLists.SUSPICIOUS))
                .corporateDomainList(domainList(s, "corporate_domain_list", DefaultDomainLists.CORPORATE))
                .riskyDomainPenalty(orDefault(s.number("risky_domain_penalty", false, PENALTY_MULTIPLIER),
                        DEFAULT_RISKY_DOMAIN_PENALTY))
                .anomalyPenalties(penalties)
                .build();
    }

    private List<String> domainList(Section s, String key, List<String> defaults) {
        List<String> domains = s.strings(key, false);
        if (domains == null) {
            return defaults;
        }
        return domains.stream().map(d -> d.trim().toLowerCase(Locale.ROOT)).toList();
    }

    private DomainRules readDomainRules(Section s) {
        DomainRules.DomainRulesBuilder rules = DomainRules.builder();
        s.forEachField((name, value) -> {
            if (name.isBlank()) {
                s.reject(name, "rule name must not be blank");
                return;
            }
            s.section(name, true, DOMAIN_RULE_KEYS).ifPresent(r -> {
                List<String> keywords = r.strings("keywords", true);
                if (keywords != null && keywords.isEmpty()) {
                    r.reject("keywords", "must contain at least one keyword");
                }
                Double multiplier = r.number("multiplier", true, RULE_MULTIPLIER);
                DomainRuleScope scope = DomainRuleScope.TEXT;
                String scopeName = r.string("scope", false, 1, 20);
                if (scopeName != null) {
                    scope = DomainRuleScope.fromWireName(scopeName);
                    if (scope == null) {
                        r.reject("scope", "must be one of text, domain");
                    }
                }
                if (keywords != null && multiplier != null && scope != null) {
                    rules.rule(name, DomainRule.builder()
                            .keywords(keywords)
                            .multiplier(multiplier)
                            .scope(scope)
                            .build());
                }
            });
        });
        return rules.build();
    }

    private static double orZero(Double value) {
        return value == null ? 0.0 : value;
    }

    private static double orDefault(Double value, double fallback) {
        return value == null ? fallback : value;
    }

    private static String trim(String value) {
        return value == null ? null : value.trim();
    }

    /**
     * Numeric bounds with open or closed ends.
     */
    private record Range(double min, boolean minInclusive, double max, boolean maxInclusive) {

        static Range closed(double min, double max) {
            return new Range(min, true, max, true);
        }

        static Range openClosed(double min, double max) {
            return new Range(min, false, max, true);
        }

        boolean contains(double value) {
            boolean aboveMin = minInclusive ? value >= min : value > min;
            boolean belowMax = maxInclusive ? value <= max : value < max;
            return aboveMin && belowMax;
        }

        String describe() {
            if (max == Double.MAX_VALUE) {
                return minInclusive ? ">= " + format(min) : "> " + format(min);
            }
            return (minInclusive ? "[" : "(") + format(min) + ", " + format(max) + (maxInclusive ? "]" : ")");
        }

        private static String format(double value) {
            return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
        }
    }

    /**
     * Cursor over one object of the document. Checks its key whitelist on construction and
     * records violations against path-qualified field names.
     */
    private static final class Section {

        private final String path;
        private final JsonNode node;
        private final List<SchemaViolation> violations;

        Section(String path, JsonNode node, List<SchemaViolation> violations, Set<String> allowedKeys) {
            this.path = path;
            this.node = node;
            this.violations = violations;
            if (allowedKeys != null) {
                node.fieldNames().forEachRemaining(name -> {
                    if (!allowedKeys.contains(name)) {
                        reject(name, "unknown field");
                    }
                });
            }
        }

        String pathOf(String key) {
            return path.isEmpty() ? key : path + "." + key;
        }

        void violation(String fullPath, String reason) {
            violations.add(new SchemaViolation(fullPath, reason));
        }

        void reject(String key, String reason) {
            violation(pathOf(key), reason);
        }

        void rejectSelf(String reason) {
            violation(path.isEmpty() ? "$" : path, reason);
        }

        void forEachField(BiConsumer<String, JsonNode> action) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                action.accept(field.getKey(), field.getValue());
            }
        }

        private JsonNode present(String key, boolean required) {
            JsonNode value = node.get(key);
            if (value == null || value.isNull()) {
                if (required) {
                    reject(key, "required field missing");
                }
                return null;
            }
            return value;
        }

        Optional<Section> section(String key, boolean required, Set<String> allowedKeys) {
            JsonNode child = node.get(key);
            if (child == null || child.isNull()) {
                if (required) {
                    reject(key, "required section missing");
                }
                return Optional.empty();
            }
            if (!child.isObject()) {
                reject(key, "must be an object");
                return Optional.empty();
            }
            return Optional.of(new Section(pathOf(key), child, violations, allowedKeys));
        }

        String string(String key, boolean required, int minLength, int maxLength) {
            JsonNode value = present(key, required);
            if (value == null) {
                return null;
            }
            if (!value.isTextual()) {
                reject(key, "must be a string");
                return null;
            }
            String text = value.asText();
            if (text.trim().length() < minLength) {
                reject(key, "must not be blank");
                return null;
            }
            if (text.length() > maxLength) {
                reject(key, "must be at most " + maxLength + " characters");
                return null;
            }
            return text;
        }

        Double number(String key, boolean required, Range range) {
            JsonNode value = present(key, required);
            if (value == null) {
                return null;
            }
            if (!value.isNumber()) {
                reject(key, "must be a number");
                return null;
            }
            double number = value.asDouble();
            if (!range.contains(number)) {
                reject(key, "must be in " + range.describe() + " (got " + value.asText() + ")");
                return null;
            }
            return number;
        }

        Boolean bool(String key, boolean required) {
            JsonNode value = present(key, required);
            if (value == null) {
                return null;
            }
            if (!value.isBoolean()) {
                reject(key, "must be a boolean");
                return null;
            }
            return value.asBoolean();
        }

        List<JsonNode> array(String key, boolean required) {
            JsonNode value = present(key, required);
            if (value == null) {
                return List.of();
            }
            if (!value.isArray()) {
                reject(key, "must be an array");
                return List.of();
            }
            List<JsonNode> elements = new ArrayList<>();
            value.elements().forEachRemaining(elements::add);
            return elements;
        }

        List<String> strings(String key, boolean required) {
            JsonNode value = present(key, required);
            if (value == null) {
                return null;
            }
            if (!value.isArray()) {
                reject(key, "must be an array of strings");
                return null;
            }
            List<String> result = new ArrayList<>();
            boolean valid = true;
            for (int i = 0; i < value.size(); i++) {
                JsonNode element = value.get(i);
                if (!element.isTextual() || element.asText().isBlank()) {
                    violation(pathOf(key) + "[" + i + "]", "must be a non-blank string");
                    valid = false;
                } else {
                    result.add(element.asText());
                }
            }
            return valid ? List.copyOf(result) : null;
        }
    }
}
