package com.outreach.scoring.engine;

import com.outreach.scoring.exception.InvalidRecordException;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.DomainClass;
import com.outreach.scoring.model.FeatureSet;
import com.outreach.scoring.model.GeoMatch;
import com.outreach.scoring.model.GeoMatchLevel;
import com.outreach.scoring.model.KeywordMatch;
import com.outreach.scoring.model.KeywordPolarity;
import com.outreach.scoring.model.KeywordTier;
import com.outreach.scoring.model.config.DomainRuleScope;
import com.outreach.scoring.model.config.DomainRules;
import com.outreach.scoring.model.config.EmailQualityRules;
import com.outreach.scoring.model.config.GeographicRules;
import com.outreach.scoring.model.config.KeywordRules;
import com.outreach.scoring.model.config.KeywordSet;
import com.outreach.scoring.model.config.KeywordTerm;
import com.outreach.scoring.model.config.RuleConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Derives the four normalized scoring signals of a record under a configuration.
 *
 * Dimensions (each 0-100):
 *   quality     - domain class, address structure and configured suspicious patterns
 *   relevance   - weighted keyword matches in company name, description and website domain
 *   geography   - target/region/others match scaled by the configured multiplier
 *   engagement  - how likely the address reaches a responsive mailbox (role prefix, page found on)
 *
 * Stateless apart from the compiled-pattern cache; safe to call from many threads.
 */
@Component
public class FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExtractor.class);

    // Relevance points per unit of keyword weight
    static final double PRIMARY_POSITIVE_POINTS = 20.0;
    static final double PRIMARY_NEGATIVE_POINTS = -10.0;
    static final double SECONDARY_POSITIVE_POINTS = 5.0;
    static final double SECONDARY_NEGATIVE_POINTS = -3.0;

    static final double GEO_TARGET_BASE = 70.0;
    static final double GEO_REGION_BASE = 50.0;
    static final double GEO_OTHER_BASE = 10.0;

    static final double QUALITY_BASE = 50.0;
    static final double CORPORATE_BONUS = 30.0;
    static final double DISPOSABLE_PENALTY = 40.0;
    static final double SUSPICIOUS_DOMAIN_PENALTY = 30.0;
    static final double PATTERN_PENALTY = 10.0;
    static final double STRUCTURE_BLEND = 0.4;

    static final double ENGAGEMENT_ADMIN = 20.0;
    static final double ENGAGEMENT_CONTACT = 80.0;
    static final double ENGAGEMENT_PRODUCT = 60.0;
    static final double ENGAGEMENT_DEFAULT = 50.0;

    private static final Pattern NO_REPLY_PREFIX =
            Pattern.compile("^(no-?reply|do-?not-?reply|mailer-daemon|bounces?)");

    private static final List<String> ADMIN_LOCAL_PARTS = List.of("noreply", "no-reply", "donotreply",
            "do-not-reply", "postmaster", "webmaster", "hostmaster", "mailer-daemon", "admin", "abuse");
    private static final List<String> CONTACT_LOCAL_PARTS = List.of("info", "contact", "sales", "vendite",
            "commerciale", "export", "office", "ufficio", "hello", "enquiries", "inquiry", "kontakt", "vertrieb");
    private static final List<String> PRODUCT_LOCAL_PARTS = List.of("product", "technical", "tecnico",
            "support", "service", "engineering", "purchasing", "acquisti", "einkauf");

    // Page the address was found on; checked in this order
    private static final List<Map.Entry<String, Double>> SOURCE_ENGAGEMENT = List.of(
            Map.entry("product", 85.0),
            Map.entry("service", 80.0),
            Map.entry("contact", 75.0),
            Map.entry("about", 65.0));

    private final PatternCache patternCache;

    public FeatureExtractor(PatternCache patternCache) {
        this.patternCache = patternCache;
    }

    /**
     * Extract the feature set of one record.
     *
     * @throws InvalidRecordException when the record has no usable email address
     */
    public FeatureSet extract(ContactRecord record, RuleConfiguration config) {
        if (record == null) {
            throw new InvalidRecordException(null, "record is missing");
        }
        String email = record.getEmail() == null ? null : record.getEmail().trim();
        checkAddress(email);

        AddressMetrics metrics = AddressMetrics.of(email);
        String declaredDomain = websiteDomain(record.getDomain());
        String companyDomain = declaredDomain != null ? declaredDomain : metrics.domain();
        EmailQualityRules qualityRules = config.getEmailQuality();

        DomainClass domainClass = classifyDomain(metrics.domain(), declaredDomain, qualityRules);
        double structural = structuralScore(metrics);
        List<String> qualityFlags = qualityFlags(email, qualityRules);
        double quality = qualityScore(domainClass, structural, qualityFlags, qualityRules);

        String text = searchableText(record, companyDomain);
        List<KeywordMatch> keywordMatches = matchKeywords(text, config.getCompanyKeywords());
        double relevance = Texts.clamp(keywordMatches.stream().mapToDouble(KeywordMatch::getPoints).sum(), 0, 100);

        GeoMatch geoMatch = matchGeography(record, config);
        double geography = geographyScore(record, config, geoMatch);

        double engagement = engagementScore(metrics.localPart(), record.getSource());
        List<String> matchedRules = matchDomainRules(config.getDomainRules(), text,
                metrics.domain() + " " + companyDomain);

        log.debug("Extracted features for {}: quality={}, relevance={}, geography={}, engagement={}",
                email, quality, relevance, geography, engagement);

        return FeatureSet.builder()
                .identifier(email)
                .localPart(metrics.localPart())
                .domain(metrics.domain())
                .domainClass(domainClass)
                .quality(quality)
                .relevance(relevance)
                .geography(geography)
                .engagement(engagement)
                .structuralScore(structural)
                .keywordMatches(keywordMatches)
                .geoMatch(geoMatch)
                .qualityFlags(qualityFlags)
                .matchedDomainRules(matchedRules)
                .build();
    }

    private void checkAddress(String email) {
        if (email == null || email.isEmpty()) {
            throw new InvalidRecordException(email, "email address is missing");
        }
        if (email.chars().anyMatch(Character::isWhitespace)) {
            throw new InvalidRecordException(email, "email address contains whitespace");
        }
        int at = email.indexOf('@');
        if (at < 0 || at != email.lastIndexOf('@')) {
            throw new InvalidRecordException(email, "email address must contain exactly one '@'");
        }
        if (at == 0) {
            throw new InvalidRecordException(email, "email address has an empty local part");
        }
        String domain = email.substring(at + 1);
        if (!domain.contains(".") || domain.startsWith(".") || domain.endsWith(".") || domain.contains("..")) {
            throw new InvalidRecordException(email, "email domain '" + domain + "' is not a valid domain");
        }
    }

    // Website domain as declared on the record, without scheme, "www." or path. Null when absent.
    private String websiteDomain(String declared) {
        if (declared == null || declared.isBlank()) {
            return null;
        }
        String domain = Texts.normalize(declared)
                .replaceFirst("^https?://", "")
                .replaceFirst("^www\\.", "");
        int slash = domain.indexOf('/');
        return slash < 0 ? domain : domain.substring(0, slash);
    }

    DomainClass classifyDomain(String domain, String declaredDomain, EmailQualityRules rules) {
        if (inList(domain, rules.getDisposableDomains())) {
            return DomainClass.DISPOSABLE;
        }
        if (inList(domain, rules.getSuspiciousDomains())) {
            return DomainClass.SUSPICIOUS;
        }
        if (inList(domain, rules.getFreeDomains())) {
            return DomainClass.FREE_MAIL;
        }
        if (inList(domain, rules.getCorporateDomainList())) {
            return DomainClass.CORPORATE;
        }
        // Address hosted on the company's own website domain
        if (declaredDomain != null && (domain.equals(declaredDomain) || domain.endsWith("." + declaredDomain))) {
            return DomainClass.CORPORATE;
        }
        return DomainClass.UNCLASSIFIED;
    }

    private static boolean inList(String domain, List<String> domains) {
        for (String listed : domains) {
            if (domain.equals(listed) || domain.endsWith("." + listed)) {
                return true;
            }
        }
        return false;
    }

    double structuralScore(AddressMetrics metrics) {
        double score = 100.0;
        int length = metrics.localLength();
        if (length < 2) {
            score -= 30;
        } else if (length < 3) {
            score -= 15;
        }
        if (length > 64) {
            score -= 40;
        } else if (length > 30) {
            score -= 20;
        }
        score -= Math.min(40.0, metrics.specialCharRatio() * 100.0);
        if (metrics.separatorRatio() > 0.3) {
            score -= 10;
        }
        if (metrics.digitRatio() > 0.5) {
            score -= 25;
        } else if (metrics.digitRatio() > 0.3) {
            score -= 10;
        }
        if (metrics.domainLength() > 40) {
            score -= 10;
        }
        if (NO_REPLY_PREFIX.matcher(metrics.localPart()).find()) {
            score -= 40;
        }
        return Texts.clamp(score, 0, 100);
    }

    private List<String> qualityFlags(String email, EmailQualityRules rules) {
        List<String> flags = new ArrayList<>();
        for (String regex : rules.getSuspiciousPatterns()) {
            if (patternCache.get(regex).matcher(email).find()) {
                flags.add(regex);
            }
        }
        return flags;
    }

    private double qualityScore(DomainClass domainClass, double structural, List<String> flags,
                                EmailQualityRules rules) {
        double score = QUALITY_BASE;
        switch (domainClass) {
            case CORPORATE -> score += CORPORATE_BONUS;
            case FREE_MAIL -> score += rules.isCorporateDomains() ? 50.0 * rules.getFreeEmailPenalty() : 0.0;
            case DISPOSABLE -> score -= DISPOSABLE_PENALTY;
            case SUSPICIOUS -> score -= SUSPICIOUS_DOMAIN_PENALTY;
            default -> {
                // unclassified domains stay neutral
            }
        }
        if (rules.isStructureQuality()) {
            score += (structural - 50.0) * STRUCTURE_BLEND;
        }
        score -= PATTERN_PENALTY * flags.size();
        return Texts.clamp(score, 0, 100);
    }

    private String searchableText(ContactRecord record, String companyDomain) {
        List<String> parts = new ArrayList<>();
        for (String part : new String[]{record.getCompanyName(), record.getDescription(),
                companyDomain.replace('.', ' ').replace('-', ' ')}) {
            String normalized = Texts.normalize(part);
            if (!normalized.isEmpty()) {
                parts.add(normalized);
            }
        }
        return String.join(" | ", parts);
    }

    /**
     * Finds configured keywords in the text. Where occurrences overlap, the longest wins and the
     * shorter ones are suppressed for that span (ties go to the earlier start). Each distinct term
     * contributes at most once.
     */
    List<KeywordMatch> matchKeywords(String text, KeywordRules rules) {
        if (text.isEmpty() || rules == null) {
            return List.of();
        }
        List<Candidate> candidates = new ArrayList<>();
        KeywordSet primary = Optional.ofNullable(rules.getPrimaryKeywords()).orElse(KeywordSet.empty());
        KeywordSet secondary = Optional.ofNullable(rules.getSecondaryKeywords()).orElse(KeywordSet.empty());
        collect(candidates, text, primary.getPositive(), KeywordPolarity.POSITIVE, KeywordTier.PRIMARY);
        collect(candidates, text, primary.getNegative(), KeywordPolarity.NEGATIVE, KeywordTier.PRIMARY);
        collect(candidates, text, secondary.getPositive(), KeywordPolarity.POSITIVE, KeywordTier.SECONDARY);
        collect(candidates, text, secondary.getNegative(), KeywordPolarity.NEGATIVE, KeywordTier.SECONDARY);

        candidates.sort(Comparator.comparingInt(Candidate::length).reversed()
                .thenComparingInt(Candidate::start)
                .thenComparingInt(Candidate::order));

        boolean[] occupied = new boolean[text.length()];
        Set<String> counted = new HashSet<>();
        List<KeywordMatch> matches = new ArrayList<>();
        for (Candidate candidate : candidates) {
            if (overlaps(occupied, candidate)) {
                continue;
            }
            for (int i = candidate.start(); i < candidate.end(); i++) {
                occupied[i] = true;
            }
            if (counted.add(candidate.normalizedTerm())) {
                matches.add(candidate.toMatch());
            }
        }
        matches.sort(Comparator.comparingInt(KeywordMatch::getStart));
        return matches;
    }

    private static void collect(List<Candidate> candidates, String text, List<KeywordTerm> terms,
                                KeywordPolarity polarity, KeywordTier tier) {
        for (KeywordTerm term : terms) {
            String needle = Texts.normalize(term.getTerm());
            if (needle.isEmpty()) {
                continue;
            }
            int from = 0;
            int index;
            while ((index = text.indexOf(needle, from)) >= 0) {
                candidates.add(new Candidate(term, needle, polarity, tier, index, index + needle.length(),
                        candidates.size()));
                from = index + 1;
            }
        }
    }

    private static boolean overlaps(boolean[] occupied, Candidate candidate) {
        for (int i = candidate.start(); i < candidate.end(); i++) {
            if (occupied[i]) {
                return true;
            }
        }
        return false;
    }

    static double pointsPerWeight(KeywordTier tier, KeywordPolarity polarity) {
        if (tier == KeywordTier.PRIMARY) {
            return polarity == KeywordPolarity.POSITIVE ? PRIMARY_POSITIVE_POINTS : PRIMARY_NEGATIVE_POINTS;
        }
        return polarity == KeywordPolarity.POSITIVE ? SECONDARY_POSITIVE_POINTS : SECONDARY_NEGATIVE_POINTS;
    }

    /**
     * Picks the multiplier by specificity: the record's country, then its region(s), then "Others".
     * Excluded countries and regions short-circuit to EXCLUDED.
     */
    GeoMatch matchGeography(ContactRecord record, RuleConfiguration config) {
        GeographicRules rules = config.getGeographicRules();
        String country = Texts.normalize(record.getCountry());
        List<String> regions = regionsOf(record, country, rules);
        boolean targetCountry = Texts.sameText(country, config.getTarget().getCountry());

        Optional<String> excludedCountry = Texts.find(rules.getExcludeRegions(), country);
        if (excludedCountry.isPresent()) {
            return geo(GeoMatchLevel.EXCLUDED, excludedCountry.get(), 0.0, false);
        }
        for (String region : regions) {
            Optional<String> excludedRegion = Texts.find(rules.getExcludeRegions(), region);
            if (excludedRegion.isPresent()) {
                return geo(GeoMatchLevel.EXCLUDED, excludedRegion.get(), 0.0, false);
            }
        }

        Optional<Map.Entry<String, Double>> byCountry = lookup(rules.getMultipliers(), country);
        if (byCountry.isPresent()) {
            return geo(GeoMatchLevel.COUNTRY, byCountry.get().getKey(), byCountry.get().getValue(), targetCountry);
        }
        for (String region : regions) {
            Optional<Map.Entry<String, Double>> byRegion = lookup(rules.getMultipliers(), region);
            if (byRegion.isPresent()) {
                return geo(GeoMatchLevel.REGION, byRegion.get().getKey(), byRegion.get().getValue(), targetCountry);
            }
        }
        Optional<Map.Entry<String, Double>> others = lookup(rules.getMultipliers(), GeographicRules.OTHERS);
        if (others.isPresent()) {
            return geo(GeoMatchLevel.OTHERS, others.get().getKey(), others.get().getValue(), targetCountry);
        }
        return geo(GeoMatchLevel.NONE, null, 1.0, targetCountry);
    }

    private double geographyScore(ContactRecord record, RuleConfiguration config, GeoMatch match) {
        if (match.getLevel() == GeoMatchLevel.EXCLUDED) {
            return 0.0;
        }
        GeographicRules rules = config.getGeographicRules();
        String country = Texts.normalize(record.getCountry());
        double base = GEO_OTHER_BASE;
        if (match.isTargetCountry() || Texts.containsIgnoreCase(rules.getTargetRegions(), country)) {
            base = GEO_TARGET_BASE;
        } else if (regionsOf(record, country, rules).stream()
                .anyMatch(r -> Texts.containsIgnoreCase(rules.getTargetRegions(), r))) {
            base = GEO_REGION_BASE;
        }
        return Texts.clamp(base * match.getMultiplier(), 0, 100);
    }

    // Declared region first, then every configured region listing the country as a member.
    // Country and region are compared in normalized form, the same form the score cache keys on.
    private static List<String> regionsOf(ContactRecord record, String country, GeographicRules rules) {
        List<String> regions = new ArrayList<>();
        String declared = Texts.normalize(record.getRegion());
        if (!declared.isEmpty()) {
            regions.add(declared);
        }
        if (!country.isEmpty()) {
            rules.getRegionMembers().forEach((region, members) -> {
                if (Texts.containsIgnoreCase(members, country) && !Texts.containsIgnoreCase(regions, region)) {
                    regions.add(region);
                }
            });
        }
        return regions;
    }

    private static Optional<Map.Entry<String, Double>> lookup(Map<String, Double> multipliers, String key) {
        return multipliers.entrySet().stream()
                .filter(e -> Texts.sameText(e.getKey(), key))
                .findFirst();
    }

    private static GeoMatch geo(GeoMatchLevel level, String key, double multiplier, boolean targetCountry) {
        return GeoMatch.builder()
                .level(level)
                .matchedKey(key)
                .multiplier(multiplier)
                .targetCountry(targetCountry)
                .build();
    }

    double engagementScore(String localPart, String source) {
        if (ADMIN_LOCAL_PARTS.stream().anyMatch(localPart::contains)) {
            return ENGAGEMENT_ADMIN;
        }
        String page = Texts.normalize(source);
        if (!page.isEmpty()) {
            for (Map.Entry<String, Double> entry : SOURCE_ENGAGEMENT) {
                if (page.contains(entry.getKey())) {
                    return entry.getValue();
                }
            }
        }
        if (CONTACT_LOCAL_PARTS.stream().anyMatch(localPart::contains)) {
            return ENGAGEMENT_CONTACT;
        }
        if (PRODUCT_LOCAL_PARTS.stream().anyMatch(localPart::contains)) {
            return ENGAGEMENT_PRODUCT;
        }
        return ENGAGEMENT_DEFAULT;
    }

    private static List<String> matchDomainRules(DomainRules rules, String text, String domains) {
        if (rules == null) {
            return List.of();
        }
        List<String> matched = new ArrayList<>();
        rules.getRules().forEach((name, rule) -> {
            String haystack = rule.getScope() == DomainRuleScope.DOMAIN ? domains : text;
            if (rule.getKeywords().stream().map(Texts::normalize).anyMatch(k -> !k.isEmpty() && haystack.contains(k))) {
                matched.add(name);
            }
        });
        return matched;
    }

    private record Candidate(KeywordTerm term, String normalizedTerm, KeywordPolarity polarity, KeywordTier tier,
                             int start, int end, int order) {

        int length() {
            return end - start;
        }

        KeywordMatch toMatch() {
            double weight = term.getWeight();
            return KeywordMatch.builder()
                    .term(term.getTerm())
                    .polarity(polarity)
                    .tier(tier)
                    .weight(weight)
                    .points(pointsPerWeight(tier, polarity) * weight)
                    .start(start)
                    .build();
        }
    }
}
