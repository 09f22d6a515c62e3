package com.outreach.scoring.service;

import com.outreach.scoring.config.MetricsConfig;
import com.outreach.scoring.config.ScoringProperties;
import com.outreach.scoring.engine.ScoringEngine;
import com.outreach.scoring.engine.anomaly.AnomalyClassifier;
import com.outreach.scoring.engine.cache.ScoreCache;
import com.outreach.scoring.engine.cache.ScoreCacheKey;
import com.outreach.scoring.model.AnomalyReport;
import com.outreach.scoring.model.BatchScoringResult;
import com.outreach.scoring.model.ContactRecord;
import com.outreach.scoring.model.PriorityTier;
import com.outreach.scoring.model.RecordStatus;
import com.outreach.scoring.model.ScoreResult;
import com.outreach.scoring.model.Severity;
import com.outreach.scoring.model.config.RuleConfiguration;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.DoubleAdder;
import java.util.concurrent.atomic.LongAdder;

/**
 * Scores batches of records against one configuration, memoizing results in the shared {@link ScoreCache}.
 *
 * Records are independent: large batches are split into contiguous chunks scored on the batch
 * worker pool. Results keep input order, and tier counts are tallied as each record is scored.
 */
@Service
public class BatchScoringService {

    private static final Logger log = LoggerFactory.getLogger(BatchScoringService.class);

    private final ScoringEngine scoringEngine;
    private final AnomalyClassifier anomalyClassifier;
    private final ScoreCache scoreCache;
    private final ExecutorService executor;
    private final ScoringProperties properties;
    private final MetricsConfig metricsConfig;

    public BatchScoringService(ScoringEngine scoringEngine,
                               AnomalyClassifier anomalyClassifier,
                               ScoreCache scoreCache,
                               @Qualifier("batchScoringExecutor") ExecutorService executor,
                               ScoringProperties properties,
                               MetricsConfig metricsConfig) {
        this.scoringEngine = scoringEngine;
        this.anomalyClassifier = anomalyClassifier;
        this.scoreCache = scoreCache;
        this.executor = executor;
        this.properties = properties;
        this.metricsConfig = metricsConfig;
    }

    @Observed(name = "scoring.score_one", contextualName = "score-record")
    public ScoreResult score(ContactRecord record, RuleConfiguration config) {
        Tally tally = new Tally();
        ScoreResult result = scoreCached(record, config, tally);
        metricsConfig.updateCacheSize(scoreCache.size());
        return result;
    }

    /**
     * Score every record. Never throws for a bad record: it comes back as INVALID_RECORD and is
     * counted as EXCLUDED.
     */
    @Observed(name = "scoring.score_all", contextualName = "score-batch")
    public BatchScoringResult scoreAll(List<ContactRecord> records, RuleConfiguration config) {
        long start = System.currentTimeMillis();
        ScoreResult[] results = new ScoreResult[records.size()];
        Tally tally = new Tally();

        int parallelism = Math.max(1, properties.getBatch().getParallelism() > 0
                ? properties.getBatch().getParallelism()
                : Runtime.getRuntime().availableProcessors());

        if (records.size() < properties.getBatch().getParallelThreshold() || parallelism == 1) {
            scoreRange(records, config, results, tally, 0, records.size());
        } else {
            scoreParallel(records, config, results, tally, parallelism);
        }
        metricsConfig.updateCacheSize(scoreCache.size());

        BatchScoringResult batch = tally.toResult(config.getFingerprint(), Arrays.asList(results));
        log.info("Scored batch of {} records in {}ms: tiers={}, invalid={}, cacheHits={}",
                records.size(), System.currentTimeMillis() - start, batch.getTierCounts(),
                batch.getInvalidCount(), batch.getCacheHits());
        return batch;
    }

    private void scoreParallel(List<ContactRecord> records, RuleConfiguration config, ScoreResult[] results,
                               Tally tally, int parallelism) {
        int chunkSize = (records.size() + parallelism - 1) / parallelism;
        List<Future<?>> futures = new ArrayList<>();
        for (int from = 0; from < records.size(); from += chunkSize) {
            int chunkStart = from;
            int chunkEnd = Math.min(records.size(), from + chunkSize);
            futures.add(executor.submit(() -> scoreRange(records, config, results, tally, chunkStart, chunkEnd)));
        }
        try {
            for (Future<?> future : futures) {
                future.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Batch scoring interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("Batch scoring failed: " + e.getCause().getMessage(), e.getCause());
        }
    }

    private void scoreRange(List<ContactRecord> records, RuleConfiguration config, ScoreResult[] results,
                            Tally tally, int from, int to) {
        for (int i = from; i < to; i++) {
            results[i] = scoreCached(records.get(i), config, tally);
        }
    }

    private ScoreResult scoreCached(ContactRecord record, RuleConfiguration config, Tally tally) {
        if (record == null) {
            ScoreResult invalid = ScoreResult.invalid(null, "record is missing");
            tally.add(invalid, false);
            metricsConfig.recordInvalidRecord();
            return invalid;
        }
        ScoreCacheKey key = ScoreCacheKey.of(record, config);
        Optional<ScoreResult> cached = scoreCache.get(key);
        metricsConfig.recordCacheLookup(cached.isPresent());
        if (cached.isPresent()) {
            tally.add(cached.get(), true);
            return cached.get();
        }

        ScoreResult result = scoringEngine.score(record, config);
        scoreCache.put(key, result);
        tally.add(result, false);

        if (result.getStatus() == RecordStatus.INVALID_RECORD) {
            metricsConfig.recordInvalidRecord();
        } else {
            metricsConfig.recordScore(result.getTier(), result.getCompositeScore());
            if (result.getAnomaly() != null && result.getAnomaly().isAnomalous()) {
                metricsConfig.recordAnomaly(result.getAnomaly().getSeverity());
            }
        }
        return result;
    }

    /**
     * Run only the anomaly classifier over the records.
     */
    @Observed(name = "scoring.classify", contextualName = "classify-anomalies")
    public List<AnomalyReport> classifyAll(List<ContactRecord> records) {
        List<AnomalyReport> reports = new ArrayList<>(records.size());
        for (ContactRecord record : records) {
            AnomalyReport report = anomalyClassifier.classify(record);
            if (report.getSeverity() != Severity.NONE) {
                metricsConfig.recordAnomaly(report.getSeverity());
            }
            reports.add(report);
        }
        return reports;
    }

    public ScoreCache.Stats clearCache() {
        ScoreCache.Stats before = scoreCache.stats();
        scoreCache.clear();
        metricsConfig.updateCacheSize(0);
        return before;
    }

    public ScoreCache.Stats cacheStats() {
        return scoreCache.stats();
    }

    /**
     * Open an interactive editing session over a fixed set of records.
     * Edits are debounced by the configured quiescence window.
     */
    public ConfigurationEditSession openEditSession(List<ContactRecord> records) {
        return new ConfigurationEditSession(this, records,
                new RecomputeScheduler(properties.getDebounceWindow()));
    }

    /**
     * Thread-safe per-batch counters, updated as each record is scored.
     */
    private static final class Tally {

        private final Map<PriorityTier, LongAdder> tierCounts = new EnumMap<>(PriorityTier.class);
        private final LongAdder invalid = new LongAdder();
        private final LongAdder cacheHits = new LongAdder();
        private final LongAdder scored = new LongAdder();
        private final DoubleAdder scoreSum = new DoubleAdder();
        private final DoubleAccumulator min = new DoubleAccumulator(Math::min, Double.POSITIVE_INFINITY);
        private final DoubleAccumulator max = new DoubleAccumulator(Math::max, Double.NEGATIVE_INFINITY);

        Tally() {
            for (PriorityTier tier : PriorityTier.values()) {
                tierCounts.put(tier, new LongAdder());
            }
        }

        void add(ScoreResult result, boolean fromCache) {
            tierCounts.get(result.getTier()).increment();
            if (fromCache) {
                cacheHits.increment();
            }
            if (result.getStatus() == RecordStatus.INVALID_RECORD) {
                invalid.increment();
                return;
            }
            scored.increment();
            scoreSum.add(result.getCompositeScore());
            min.accumulate(result.getCompositeScore());
            max.accumulate(result.getCompositeScore());
        }

        BatchScoringResult toResult(String configFingerprint, List<ScoreResult> results) {
            Map<PriorityTier, Long> counts = new EnumMap<>(PriorityTier.class);
            tierCounts.forEach((tier, count) -> counts.put(tier, count.sum()));
            long scoredCount = scored.sum();
            return BatchScoringResult.builder()
                    .configFingerprint(configFingerprint)
                    .total(results.size())
                    .tierCounts(counts)
                    .invalidCount(invalid.sum())
                    .cacheHits(cacheHits.sum())
                    .averageScore(scoredCount == 0 ? 0.0 : Math.round(scoreSum.sum() / scoredCount * 100.0) / 100.0)
                    .minScore(scoredCount == 0 ? 0.0 : min.get())
                    .maxScore(scoredCount == 0 ? 0.0 : max.get())
                    .results(results)
                    .build();
        }
    }
}
