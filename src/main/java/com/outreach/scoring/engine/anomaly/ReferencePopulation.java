package com.outreach.scoring.engine.anomaly;

import com.outreach.scoring.config.AnomalyProperties;
import com.outreach.scoring.engine.AddressMetrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Fixed reference data for the statistical and neighbor-density checks.
 *
 * Per-feature mean/std-dev come from configuration; features without a configured entry are
 * derived from the reference addresses. The reference addresses are also kept as standardized
 * vectors over {@link AddressFeature#STRUCTURAL} for k-nearest-neighbor distances.
 *
 * The density baseline is a percentile of the sample's own leave-one-out k-distances, so a
 * record is only sparse when it sits further out than nearly every reference address does.
 */
final class ReferencePopulation {

    private final Map<AddressFeature, FeatureStats> stats;
    private final List<double[]> sample;
    private final int k;
    private final double baselineKDistance;

    record FeatureStats(double mean, double stdDev) {
    }

    private ReferencePopulation(Map<AddressFeature, FeatureStats> stats, List<double[]> sample, int k,
                                double baselinePercentile) {
        this.stats = stats;
        this.sample = sample;
        this.k = k;
        double[] kDistances = new double[sample.size()];
        for (int i = 0; i < sample.size(); i++) {
            kDistances[i] = kDistance(sample.get(i), i);
        }
        this.baselineKDistance = percentile(kDistances, baselinePercentile);
    }

    static ReferencePopulation from(AnomalyProperties properties) {
        List<AddressMetrics> addresses = properties.getReferenceAddresses().stream()
                .map(AddressMetrics::of)
                .toList();

        Map<AddressFeature, FeatureStats> stats = new EnumMap<>(AddressFeature.class);
        for (AddressFeature feature : AddressFeature.STRUCTURAL) {
            derive(feature, addresses).ifPresent(s -> stats.put(feature, s));
        }
        for (AnomalyProperties.FeatureStatistics configured : properties.getPopulation()) {
            if (configured.getFeature() != null) {
                stats.put(configured.getFeature(), new FeatureStats(configured.getMean(), configured.getStdDev()));
            }
        }

        List<double[]> sample = new ArrayList<>();
        for (AddressMetrics metrics : addresses) {
            sample.add(standardize(stats, metrics));
        }
        int k = Math.max(1, Math.min(properties.getNeighborDensity().getK(), sample.size() - 1));
        return new ReferencePopulation(stats, sample, k, properties.getNeighborDensity().getBaselinePercentile());
    }

    private static Optional<FeatureStats> derive(AddressFeature feature, List<AddressMetrics> addresses) {
        if (addresses.size() < 2) {
            return Optional.empty();
        }
        double[] values = addresses.stream()
                .mapToDouble(m -> feature.measure(m, null).orElse(0.0))
                .toArray();
        double mean = Arrays.stream(values).average().orElse(0.0);
        double variance = Arrays.stream(values).map(v -> (v - mean) * (v - mean)).sum() / values.length;
        return Optional.of(new FeatureStats(mean, Math.sqrt(variance)));
    }

    Optional<FeatureStats> stats(AddressFeature feature) {
        return Optional.ofNullable(stats.get(feature));
    }

    int sampleSize() {
        return sample.size();
    }

    double[] standardize(AddressMetrics metrics) {
        return standardize(stats, metrics);
    }

    private static double[] standardize(Map<AddressFeature, FeatureStats> stats, AddressMetrics metrics) {
        double[] vector = new double[AddressFeature.STRUCTURAL.size()];
        for (int i = 0; i < vector.length; i++) {
            AddressFeature feature = AddressFeature.STRUCTURAL.get(i);
            double value = feature.measure(metrics, null).orElse(0.0);
            FeatureStats s = stats.get(feature);
            if (s == null) {
                vector[i] = value;
            } else {
                vector[i] = (value - s.mean()) / (s.stdDev() > 0 ? s.stdDev() : 1.0);
            }
        }
        return vector;
    }

    /**
     * Ratio of the vector's k-distance to the baseline k-distance of the sample.
     * Values above 1 mean the vector has fewer near neighbors than almost every reference point.
     * Empty when the sample is too small or has no spread to measure against.
     */
    OptionalDouble densityRatio(double[] vector) {
        if (sample.size() < 2 || baselineKDistance <= 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(kDistance(vector, -1) / baselineKDistance);
    }

    double baselineKDistance() {
        return baselineKDistance;
    }

    // Nearest-rank percentile; 0 for an empty array.
    static double percentile(double[] values, double fraction) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double clamped = Math.min(1.0, Math.max(0.0, fraction));
        int rank = (int) Math.ceil(clamped * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, rank))];
    }

    // Mean distance to the k nearest sample points, skipping the point at excludeIndex.
    private double kDistance(double[] vector, int excludeIndex) {
        double[] distances = new double[sample.size() - (excludeIndex >= 0 ? 1 : 0)];
        int n = 0;
        for (int i = 0; i < sample.size(); i++) {
            if (i != excludeIndex) {
                distances[n++] = distance(vector, sample.get(i));
            }
        }
        Arrays.sort(distances);
        int neighbors = Math.min(k, distances.length);
        double total = 0.0;
        for (int i = 0; i < neighbors; i++) {
            total += distances[i];
        }
        return neighbors == 0 ? 0.0 : total / neighbors;
    }

    private static double distance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }
}
