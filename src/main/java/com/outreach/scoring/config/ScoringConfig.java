package com.outreach.scoring.config;

import com.outreach.scoring.engine.cache.ScoreCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-wide scoring resources: the score cache and the batch worker pool.
 */
@Configuration
public class ScoringConfig {

    @Bean
    public ScoreCache scoreCache(ScoringProperties properties) {
        ScoreCache cache = new ScoreCache(properties.getCache().getCapacity(),
                properties.getCache().getTtl(), Clock.systemUTC());
        cache.init();
        return cache;
    }

    @Bean(name = "batchScoringExecutor", destroyMethod = "shutdown")
    public ExecutorService batchScoringExecutor(ScoringProperties properties) {
        int parallelism = properties.getBatch().getParallelism() > 0
                ? properties.getBatch().getParallelism()
                : Runtime.getRuntime().availableProcessors();
        AtomicInteger threadCount = new AtomicInteger();
        return Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "batch-scoring-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
