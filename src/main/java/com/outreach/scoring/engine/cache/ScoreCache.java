package com.outreach.scoring.engine.cache;

import com.outreach.scoring.model.ScoreResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded least-recently-used cache of score results with a per-entry time-to-live.
 *
 * All map operations, including eviction, run under one lock, so a lookup never observes
 * a half-evicted entry. Must be {@link #init() initialized} before use.
 */
public class ScoreCache {

    private static final Logger log = LoggerFactory.getLogger(ScoreCache.class);

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<ScoreCacheKey, CachedScore> entries;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();

    private volatile boolean initialized;

    private record CachedScore(ScoreResult result, Instant storedAt) {
    }

    public record Stats(int size, int capacity, long hits, long misses, long evictions) {
    }

    /**
     * @param capacity maximum entries; 0 disables caching
     * @param ttl      entry lifetime; null or zero means entries never expire
     */
    public ScoreCache(int capacity, Duration ttl, Clock clock) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must be >= 0");
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<ScoreCacheKey, CachedScore> eldest) {
                if (size() > ScoreCache.this.capacity) {
                    evictions.increment();
                    return true;
                }
                return false;
            }
        };
    }

    public void init() {
        lock.lock();
        try {
            entries.clear();
            hits.reset();
            misses.reset();
            evictions.reset();
            initialized = true;
        } finally {
            lock.unlock();
        }
        log.info("Score cache initialized: capacity={}, ttl={}", capacity, ttl);
    }

    public void clear() {
        int dropped;
        lock.lock();
        try {
            dropped = entries.size();
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("Score cache cleared, {} entries dropped", dropped);
    }

    public Optional<ScoreResult> get(ScoreCacheKey key) {
        checkInitialized();
        lock.lock();
        try {
            CachedScore entry = entries.get(key);
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }
            if (isExpired(entry)) {
                entries.remove(key);
                misses.increment();
                return Optional.empty();
            }
            hits.increment();
            return Optional.of(entry.result());
        } finally {
            lock.unlock();
        }
    }

    public void put(ScoreCacheKey key, ScoreResult result) {
        checkInitialized();
        if (capacity == 0) {
            return;
        }
        lock.lock();
        try {
            entries.put(key, new CachedScore(result, clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public Stats stats() {
        return new Stats(size(), capacity, hits.sum(), misses.sum(), evictions.sum());
    }

    private boolean isExpired(CachedScore entry) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return false;
        }
        return !clock.instant().isBefore(entry.storedAt().plus(ttl));
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Score cache used before init()");
        }
    }
}
