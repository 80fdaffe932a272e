package com.search.cache.expiry;

import com.search.cache.key.CacheKey;
import com.search.cache.logging.LogContext;
import com.search.cache.metrics.CacheMetrics;
import com.search.cache.stats.StatsCollector;
import com.search.cache.tier.Tier;
import com.search.cache.tier.TierKind;
import com.search.cache.tier.TieredStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Removes expired entries from every tier, whether or not they are ever read
 * again.
 *
 * <p>Work is done in bounded batches: expired keys are collected without any
 * tier lock, then removed one at a time, each removal holding the tier lock
 * only briefly, and the thread yields between batches. A tick processes at most
 * {@code maxBatchesPerTier} batches per tier; whatever remains is picked up on
 * the next tick. Each tick also re-probes cold storage so an unavailable cold
 * tier comes back once its storage recovers.</p>
 */
public class ExpiryReaper {
    private static final Logger log = LoggerFactory.getLogger(ExpiryReaper.class);

    private static final int DEFAULT_MAX_BATCHES_PER_TIER = 16;

    private final TieredStore store;
    private final StatsCollector stats;
    private final CacheMetrics metrics;
    private final Clock clock;
    private final int batchSize;
    private final int maxBatchesPerTier;

    public ExpiryReaper(TieredStore store, StatsCollector stats, CacheMetrics metrics, Clock clock, int batchSize) {
        this(store, stats, metrics, clock, batchSize, DEFAULT_MAX_BATCHES_PER_TIER);
    }

    public ExpiryReaper(TieredStore store, StatsCollector stats, CacheMetrics metrics, Clock clock,
                        int batchSize, int maxBatchesPerTier) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxBatchesPerTier <= 0) {
            throw new IllegalArgumentException("maxBatchesPerTier must be > 0");
        }
        this.store = store;
        this.stats = stats;
        this.metrics = metrics;
        this.clock = clock;
        this.batchSize = batchSize;
        this.maxBatchesPerTier = maxBatchesPerTier;
    }

    /**
     * Runs one tick.
     */
    public ReapResult reap() {
        try (LogContext ctx = LogContext.forSweep("reap")) {
            long startNanos = System.nanoTime();
            boolean coldAvailable = store.coldTier().probe();
            Map<TierKind, Integer> removed = new EnumMap<>(TierKind.class);
            int batches = 0;
            for (Tier tier : store.tiers()) {
                int tierRemoved = 0;
                for (int batch = 0; batch < maxBatchesPerTier; batch++) {
                    Instant now = clock.instant();
                    List<CacheKey> expired = tier.expiredKeys(now, batchSize);
                    if (expired.isEmpty()) {
                        break;
                    }
                    batches++;
                    for (CacheKey key : expired) {
                        if (tier.removeIfExpired(key, now)) {
                            tierRemoved++;
                        }
                    }
                    if (expired.size() < batchSize) {
                        break;
                    }
                    Thread.yield();
                }
                removed.put(tier.kind(), tierRemoved);
                if (tierRemoved > 0) {
                    stats.recordExpirations(tierRemoved);
                    metrics.recordExpirations(tier.kind(), tierRemoved);
                }
            }
            ReapResult result = new ReapResult(removed, batches,
                    Duration.ofNanos(System.nanoTime() - startNanos), coldAvailable);
            if (result.totalRemoved() > 0) {
                log.debug("reaper.completed removed={} batches={} elapsedMs={}",
                        result.removed(), batches, result.elapsed().toMillis());
            }
            return result;
        }
    }

    /**
     * Entry point for the scheduler: a failing tick is logged and the schedule
     * keeps running.
     */
    public void runScheduled() {
        try {
            reap();
        } catch (RuntimeException e) {
            log.warn("reaper.failed error={}", e.toString(), e);
        }
    }
}
