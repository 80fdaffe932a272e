package com.search.cache.migration;

import com.search.cache.key.CacheKey;
import com.search.cache.logging.LogContext;
import com.search.cache.metrics.CacheMetrics;
import com.search.cache.stats.StatsCollector;
import com.search.cache.tier.CacheEntry;
import com.search.cache.tier.EvictionReport;
import com.search.cache.tier.Migration;
import com.search.cache.tier.Tier;
import com.search.cache.tier.TierKind;
import com.search.cache.tier.TieredStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Moves entries between tiers off the caller's thread.
 *
 * <p>Hits in the warm and cold tiers are counted by a {@link PromotionTracker};
 * a key that reaches the threshold is promoted one tier up. Entries a tier
 * evicts for capacity are offered one tier down and dropped if the lower tier
 * would have to give up something of equal or higher priority. A periodic
 * sweep also demotes hot and warm entries that have sat idle past their
 * configured timeout.</p>
 *
 * <p>Every move is handed to the migration executor, so a decision never
 * blocks the lookup that triggered it.</p>
 */
public class TierMigrator {
    private static final Logger log = LoggerFactory.getLogger(TierMigrator.class);

    private static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private final TieredStore store;
    private final PromotionTracker tracker;
    private final StatsCollector stats;
    private final CacheMetrics metrics;
    private final Executor executor;
    private final Clock clock;
    private final Duration hotIdleTimeout;
    private final Duration warmIdleTimeout;
    private final int batchSize;

    public TierMigrator(TieredStore store, PromotionTracker tracker, StatsCollector stats, CacheMetrics metrics,
                        Executor executor, Clock clock, Duration hotIdleTimeout, Duration warmIdleTimeout,
                        int batchSize) {
        this.store = store;
        this.tracker = tracker;
        this.stats = stats;
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
        this.hotIdleTimeout = hotIdleTimeout;
        this.warmIdleTimeout = warmIdleTimeout;
        this.batchSize = batchSize;
    }

    /**
     * Single worker with a bounded queue. Moves that do not fit in the queue
     * are dropped: the entry simply stays where it is or is discarded.
     */
    public static ExecutorService defaultExecutor() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(DEFAULT_QUEUE_CAPACITY),
                daemonThreads("search-cache-migrator"),
                (task, pool) -> log.debug("migration.task.dropped reason=queue-full"));
    }

    public static ThreadFactory daemonThreads(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Called after every lookup hit. Hot hits need nothing.
     */
    public void onHit(CacheKey key, TierKind tier) {
        if (tier == TierKind.HOT) {
            return;
        }
        if (tracker.recordHit(key)) {
            submit(() -> promote(key, tier));
        }
    }

    /**
     * Called with the report of every tier insert: counts the evictions and
     * schedules the evicted entries for demotion.
     */
    public void onEvictions(TierKind tier, EvictionReport report) {
        int count = report.evictedCount();
        if (count == 0) {
            return;
        }
        stats.recordEviction(tier, count);
        metrics.recordEviction(tier, count);
        if (tier.lower().isEmpty()) {
            return;
        }
        for (CacheEntry evicted : report.evicted()) {
            submit(() -> demote(evicted, tier));
        }
    }

    /**
     * Forgets any pending promotion count for the key.
     */
    public void forget(CacheKey key) {
        tracker.forget(key);
    }

    public void reset() {
        tracker.clear();
    }

    /**
     * Demotes idle entries: hot entries idle past the hot timeout go to warm,
     * warm entries idle past the warm timeout go to cold. At most one batch per
     * tier per call.
     *
     * @return the number of entries moved
     */
    public int sweep() {
        try (LogContext ctx = LogContext.forSweep("migrate-sweep")) {
            Instant now = clock.instant();
            int moved = demoteIdle(TierKind.HOT, now.minus(hotIdleTimeout));
            moved += demoteIdle(TierKind.WARM, now.minus(warmIdleTimeout));
            if (moved > 0) {
                log.debug("migration.sweep.completed demoted={}", moved);
            }
            return moved;
        }
    }

    /**
     * Entry point for the scheduler: a failing sweep is logged and the schedule
     * keeps running.
     */
    public void runScheduled() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("migration.sweep.failed error={}", e.toString(), e);
        }
    }

    private int demoteIdle(TierKind from, Instant cutoff) {
        Tier tier = store.tier(from);
        List<CacheKey> idle = tier.idleKeys(cutoff, batchSize);
        int moved = 0;
        for (CacheKey key : idle) {
            Migration migration = store.demoteResident(key, from);
            if (migration.moved()) {
                moved++;
                recordDemotion(migration);
            }
            Thread.yield();
        }
        return moved;
    }

    void promote(CacheKey key, TierKind from) {
        Migration migration = store.promote(key, from);
        if (!migration.moved()) {
            log.debug("migration.promote.skipped key={} from={}", key.shortHex(), from);
            return;
        }
        stats.recordPromotion();
        metrics.recordPromotion(migration.from(), migration.to());
        log.debug("migration.promoted key={} from={} to={}", key.shortHex(), migration.from(), migration.to());
        onEvictions(migration.to(), migration.destination());
    }

    void demote(CacheEntry evicted, TierKind from) {
        Migration migration = store.demoteEvicted(evicted, from);
        if (!migration.moved()) {
            log.debug("migration.demote.dropped key={} from={}", evicted.key().shortHex(), from);
            return;
        }
        recordDemotion(migration);
    }

    private void recordDemotion(Migration migration) {
        stats.recordDemotion();
        metrics.recordDemotion(migration.from(), migration.to());
        onEvictions(migration.to(), migration.destination());
    }

    private void submit(Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.warn("migration.task.failed error={}", e.toString(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("migration.task.rejected reason={}", e.getMessage());
        }
    }
}
