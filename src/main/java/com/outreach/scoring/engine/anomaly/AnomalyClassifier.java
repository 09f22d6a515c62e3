package com.outreach.scoring.engine.anomaly;

import com.outreach.scoring.config.AnomalyProperties;
import com.outreach.scoring.engine.AddressMetrics;
import com.outreach.scoring.model.AnomalyFlag;
import com.outreach.scoring.model.AnomalyReport;
import com.outreach.scoring.model.AnomalyType;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Heuristic anomaly classifier. Three independent checks, all parameterized by {@link AnomalyProperties}:
 *
 *   1. Pattern signatures   - regexes for disposable, bot-generated and spam-trap addresses
 *   2. Neighbor density     - k-nearest-neighbor distance against a reference sample (local-outlier notion)
 *   3. Statistical outliers - per-feature z-score against the reference population
 *
 * The report carries the highest severity among the flags that fired and lists every reason.
 * Nothing is learned at runtime; the classifier performs no I/O.
 */
@Component
public class AnomalyClassifier {

    private static final Logger log = LoggerFactory.getLogger(AnomalyClassifier.class);

    private final AnomalyProperties properties;
    private final List<Signature> signatures;
    private final ReferencePopulation population;

    public AnomalyClassifier(AnomalyProperties properties) {
        this.properties = properties;
        this.signatures = compile(properties.getPatterns());
        this.population = ReferencePopulation.from(properties);
        log.info("Anomaly classifier ready: {} pattern signatures, {} reference addresses, sigma={}, density baseline={}",
                signatures.size(), population.sampleSize(), properties.getOutlierSigma(),
                String.format(Locale.ROOT, "%.3f", population.baselineKDistance()));
    }

    public AnomalyReport classify(ContactRecord record) {
        return classify(record, List.of());
    }

    /**
     * Classify a record, also reporting the configured quality patterns it matched during feature extraction.
     */
    public AnomalyReport classify(ContactRecord record, List<String> qualityFlags) {
        String email = record.getEmail() == null ? "" : record.getEmail().trim();
        String address = email.toLowerCase(Locale.ROOT);
        AddressMetrics metrics = AddressMetrics.of(email);

        List<AnomalyFlag> flags = new ArrayList<>();
        checkSignatures(address, flags);
        for (String pattern : qualityFlags) {
            flags.add(flag(AnomalyType.QUALITY_PATTERN, Severity.LOW,
                    "Matches configured suspicious pattern '" + pattern + "'"));
        }
        checkNeighborDensity(metrics, flags);
        checkStatistics(metrics, record, flags);

        if (flags.isEmpty()) {
            return AnomalyReport.clean(email);
        }

        // Ties keep the earliest flag, so signature matches win over statistical ones
        AnomalyFlag top = flags.stream()
                .max(Comparator.comparing(AnomalyFlag::getSeverity))
                .orElseThrow();

        if (top.getSeverity().isAtLeast(Severity.HIGH)) {
            log.debug("Anomalous record {}: {} {} ({} flags)", email, top.getSeverity(), top.getType(), flags.size());
        }

        return AnomalyReport.builder()
                .identifier(email)
                .type(top.getType())
                .severity(top.getSeverity())
                .flags(List.copyOf(flags))
                .build();
    }

    private void checkSignatures(String address, List<AnomalyFlag> flags) {
        for (Signature signature : signatures) {
            if (signature.pattern().matcher(address).find()) {
                flags.add(flag(signature.type(), signature.severity(),
                        "Matches " + signature.type().name().toLowerCase(Locale.ROOT).replace('_', '-')
                                + " signature '" + signature.name() + "'"));
            }
        }
    }

    private void checkNeighborDensity(AddressMetrics metrics, List<AnomalyFlag> flags) {
        AnomalyProperties.NeighborDensity config = properties.getNeighborDensity();
        if (!config.isEnabled() || population.sampleSize() < config.getMinSampleSize()) {
            return;
        }
        OptionalDouble ratio = population.densityRatio(population.standardize(metrics));
        if (ratio.isEmpty()) {
            return;
        }
        // sensitivity 1.0 flags anything sparser than the baseline, 0.0 needs three times sparser
        double threshold = 1.0 + 2.0 * (1.0 - config.getSensitivity());
        if (ratio.getAsDouble() > threshold) {
            Severity severity = config.getSensitivity() >= config.getHighSeverityCutoff()
                    || ratio.getAsDouble() > 2 * threshold ? Severity.HIGH : Severity.MEDIUM;
            flags.add(flag(AnomalyType.LOCAL_OUTLIER, severity, String.format(Locale.ROOT,
                    "Few near neighbors in reference sample: k-distance %.1fx the sample baseline",
                    ratio.getAsDouble())));
        }
    }

    private void checkStatistics(AddressMetrics metrics, ContactRecord record, List<AnomalyFlag> flags) {
        double sigma = properties.getOutlierSigma();
        for (AddressFeature feature : AddressFeature.values()) {
            OptionalDouble value = feature.measure(metrics, record);
            if (value.isEmpty()) {
                continue;
            }
            population.stats(feature).ifPresent(stats -> {
                if (stats.stdDev() <= 0) {
                    return;
                }
                double z = Math.abs(value.getAsDouble() - stats.mean()) / stats.stdDev();
                if (z > sigma) {
                    Severity severity = z > 2 * sigma ? Severity.HIGH
                            : z > 1.5 * sigma ? Severity.MEDIUM
                            : Severity.LOW;
                    flags.add(flag(AnomalyType.STATISTICAL_OUTLIER, severity, String.format(Locale.ROOT,
                            "%s %.2f deviates %.1f standard deviations from reference mean %.2f",
                            feature.label(), value.getAsDouble(), z, stats.mean())));
                }
            });
        }
    }

    private static AnomalyFlag flag(AnomalyType type, Severity severity, String reason) {
        return AnomalyFlag.builder().type(type).severity(severity).reason(reason).build();
    }

    private static List<Signature> compile(List<AnomalyProperties.PatternSignature> configured) {
        List<Signature> compiled = new ArrayList<>();
        for (AnomalyProperties.PatternSignature signature : configured) {
            if (signature.getType() == null || signature.getRegex() == null) {
                throw new IllegalStateException("Anomaly pattern '" + signature.getName() + "' needs a type and a regex");
            }
            Pattern pattern;
            try {
                pattern = Pattern.compile(signature.getRegex(), Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                throw new IllegalStateException("Anomaly pattern '" + signature.getName() + "' is not a valid regex", e);
            }
            // Spam traps always exclude, whatever severity is configured
            Severity severity = signature.getType() == AnomalyType.SPAM_TRAP ? Severity.CRITICAL
                    : signature.getSeverity() != null ? signature.getSeverity()
                    : Severity.MEDIUM;
            compiled.add(new Signature(signature.getName(), pattern, signature.getType(), severity));
        }
        return List.copyOf(compiled);
    }

    private record Signature(String name, Pattern pattern, AnomalyType type, Severity severity) {
    }
}
