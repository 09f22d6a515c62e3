package com.outreach.scoring.config;

import com.outreach.scoring.engine.anomaly.AddressFeature;
import com.outreach.scoring.model.AnomalyType;
import com.outreach.scoring.model.Severity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the anomaly classifier. All three checks are driven by these values; nothing is learned.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyProperties {

    // Statistical check: flag a feature whose |z-score| exceeds this many standard deviations.
    private double outlierSigma = 3.0;

    // Reference population per feature. Features without an entry fall back to
    // mean/std-dev computed from the reference addresses.
    private List<FeatureStatistics> population = new ArrayList<>();

    private List<PatternSignature> patterns = defaultPatterns();

    private NeighborDensity neighborDensity = new NeighborDensity();

    // Known-good addresses forming the reference sample for the density check.
    private List<String> referenceAddresses = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FeatureStatistics {
        private AddressFeature feature;
        private double mean;
        private double stdDev;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PatternSignature {
        private String name;
        private String regex;
        private AnomalyType type;
        // Ignored for SPAM_TRAP signatures, which are always CRITICAL.
        private Severity severity;
    }

    @Data
    public static class NeighborDensity {
        private boolean enabled = true;
        // Neighbors considered for the local density estimate.
        private int k = 5;
        // 0..1, higher flags more records.
        private double sensitivity = 0.7;
        // At or above this sensitivity a density outlier is reported as HIGH instead of MEDIUM.
        private double highSeverityCutoff = 0.9;
        // Minimum reference addresses before the check runs.
        private int minSampleSize = 10;
        // Percentile of the sample's own k-distances used as the "ordinary sparseness" baseline.
        private double baselinePercentile = 0.95;
    }

    static List<PatternSignature> defaultPatterns() {
        List<PatternSignature> patterns = new ArrayList<>();
        patterns.add(new PatternSignature("role-account-trap",
                "^(test|demo|abuse|postmaster|webmaster|root|spamtrap)@", AnomalyType.SPAM_TRAP, Severity.CRITICAL));
        patterns.add(new PatternSignature("disposable-service",
                "@.*(tempmail|10minute|guerrilla|mailinator|maildrop|throwaway)", AnomalyType.DISPOSABLE_DOMAIN, Severity.HIGH));
        patterns.add(new PatternSignature("bot-local-part",
                "^[a-z0-9]{20,}@", AnomalyType.BOT_GENERATED, Severity.HIGH));
        patterns.add(new PatternSignature("placeholder-keyword",
                "(fake|example|sample|xxx|yyy|zzz)", AnomalyType.SUSPICIOUS_KEYWORD, Severity.MEDIUM));
        patterns.add(new PatternSignature("special-prefix",
                "^[!#$%&'*+]+", AnomalyType.BOT_GENERATED, Severity.MEDIUM));
        return patterns;
    }
}
