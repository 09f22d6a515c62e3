package com.outreach.scoring.config;

import com.outreach.scoring.model.PriorityTier;
import com.outreach.scoring.model.Severity;
import com.outreach.scoring.model.bulk.RequestState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger cacheSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.cacheSize = registry.gauge("scoring.cache.size", new AtomicInteger(0));
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }

    public void recordScore(PriorityTier tier, double compositeScore) {
        Counter.builder("scoring.record.count")
                .tag("tier", tier.name())
                .register(registry)
                .increment();

        DistributionSummary.builder("scoring.composite_score")
                .tag("tier", tier.name())
                .register(registry)
                .record(compositeScore);
    }

    public void recordInvalidRecord() {
        Counter.builder("scoring.record.invalid.count")
                .register(registry)
                .increment();
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("scoring.cache.lookup.count")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    public void updateCacheSize(int size) {
        cacheSize.set(size);
    }

    public void recordAnomaly(Severity severity) {
        Counter.builder("anomaly.flagged.count")
                .tag("severity", severity.name())
                .register(registry)
                .increment();
    }

    public void recordBulkUpdate(RequestState state, int updated, int failed) {
        Counter.builder("bulk.request.count")
                .tag("state", state.name())
                .register(registry)
                .increment();

        Counter.builder("bulk.target.count")
                .tag("outcome", "updated")
                .register(registry)
                .increment(updated);

        Counter.builder("bulk.target.count")
                .tag("outcome", "failed")
                .register(registry)
                .increment(failed);
    }
}
