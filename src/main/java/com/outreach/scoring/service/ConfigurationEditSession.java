package com.outreach.scoring.service;

import com.outreach.scoring.model.BatchScoringResult;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.config.RuleConfiguration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Interactive editing over a fixed record set: each {@link #edit} reschedules a debounced rescoring,
 * and {@link #latestResult()} always reflects the most recent edit that finished computing.
 */
public class ConfigurationEditSession implements AutoCloseable {

    private final BatchScoringService scoringService;
    private final List<ContactRecord> records;
    private final RecomputeScheduler scheduler;

    private final AtomicReference<BatchScoringResult> latest = new AtomicReference<>();
    private final AtomicReference<RuleConfiguration> current = new AtomicReference<>();
    private final AtomicInteger recomputations = new AtomicInteger();

    ConfigurationEditSession(BatchScoringService scoringService, List<ContactRecord> records,
                             RecomputeScheduler scheduler) {
        this.scoringService = scoringService;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
        this.scheduler = scheduler;
    }

    public void edit(RuleConfiguration config) {
        current.set(config);
        scheduler.schedule(() -> {
            recomputations.incrementAndGet();
            return scoringService.scoreAll(records, config);
        }, latest::set);
    }

    public Optional<BatchScoringResult> latestResult() {
        return Optional.ofNullable(latest.get());
    }

    public Optional<RuleConfiguration> currentConfiguration() {
        return Optional.ofNullable(current.get());
    }

    public RecomputeScheduler.State state() {
        return scheduler.getState();
    }

    // Number of recomputes that actually started
    public int recomputations() {
        return recomputations.get();
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
