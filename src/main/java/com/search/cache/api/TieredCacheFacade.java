package com.search.cache.api;

import com.search.cache.codec.CodecRegistry;
import com.search.cache.codec.CorruptEntryException;
import com.search.cache.codec.EncodedPayload;
import com.search.cache.expiry.ExpiryReaper;
import com.search.cache.expiry.ReapResult;
import com.search.cache.health.ColdStorageHealthCheck;
import com.search.cache.health.HealthCheckRegistry;
import com.search.cache.health.HealthStatus;
import com.search.cache.health.TierCapacityHealthCheck;
import com.search.cache.key.CacheKey;
import com.search.cache.key.KeyDeriver;
import com.search.cache.logging.LogContext;
import com.search.cache.metrics.CacheMetrics;
import com.search.cache.metrics.NoOpCacheMetrics;
import com.search.cache.migration.EntryScorer;
import com.search.cache.migration.PromotionTracker;
import com.search.cache.migration.TierMigrator;
import com.search.cache.stats.StatsCollector;
import com.search.cache.stats.StatsSnapshot;
import com.search.cache.tier.CacheEntry;
import com.search.cache.tier.ColdStore;
import com.search.cache.tier.ColdTier;
import com.search.cache.tier.EvictionReport;
import com.search.cache.tier.FileSystemColdStore;
import com.search.cache.tier.HotTier;
import com.search.cache.tier.KeyStripes;
import com.search.cache.tier.Tier;
import com.search.cache.tier.TierKind;
import com.search.cache.tier.TierListener;
import com.search.cache.tier.TieredStore;
import com.search.cache.tier.WarmTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Three-tier cache for search results: a raw in-memory hot tier, a compressed
 * in-memory warm tier and a compressed on-disk cold tier.
 *
 * <p>Lookups probe hot, warm, then cold. Concurrent misses for the same key
 * are coalesced: one caller (the leader) runs its fill function and the others
 * wait for its result. A failed fill is never cached; waiting callers then try
 * again themselves. Tier moves and expiry run in the background.</p>
 *
 * <pre>
 * try (CacheFacade cache = TieredCacheFacade.builder()
 *         .config(TieredCacheConfig.builder().coldDirectory(dir).build())
 *         .build()) {
 *     byte[] result = cache.getOrCompute(params, () -> backend.search(params));
 * }
 * </pre>
 */
public class TieredCacheFacade implements CacheFacade {
    private static final Logger log = LoggerFactory.getLogger(TieredCacheFacade.class);

    private final TieredCacheConfig config;
    private final Clock clock;
    private final CacheMetrics metrics;
    private final KeyDeriver keyDeriver = new KeyDeriver();
    private final CodecRegistry codecs;
    private final StatsCollector stats;
    private final TieredStore store;
    private final PromotionTracker tracker;
    private final TierMigrator migrator;
    private final ExpiryReaper reaper;
    private final HealthCheckRegistry healthChecks = new HealthCheckRegistry();
    private final ConcurrentHashMap<CacheKey, CompletableFuture<byte[]>> inFlight = new ConcurrentHashMap<>();
    private final ExecutorService ownedMigrationExecutor;
    private final ScheduledExecutorService maintenance;
    private final AtomicBoolean closed = new AtomicBoolean();

    private TieredCacheFacade(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.metrics = builder.metrics;
        this.codecs = builder.codecs != null
                ? builder.codecs
                : CodecRegistry.withPreference(config.getPreferredCodec());
        this.stats = new StatsCollector(config.getHotKeyLimit());

        TierListener listener = new StatsTierListener();
        ColdStore coldStore = builder.coldStore != null
                ? builder.coldStore
                : new FileSystemColdStore(config.getColdDirectory());
        HotTier hot = new HotTier(config.getHotBudgetBytes(), clock, listener);
        WarmTier warm = new WarmTier(config.getWarmBudgetBytes(), new EntryScorer(config.getScoringWeights()),
                clock, listener);
        ColdTier cold = new ColdTier(coldStore, config.getColdBudgetBytes(), clock, listener);
        this.store = new TieredStore(hot, warm, cold, codecs, new KeyStripes(config.getLockStripes()), listener);

        Executor migrationExecutor = builder.migrationExecutor;
        if (migrationExecutor == null) {
            this.ownedMigrationExecutor = TierMigrator.defaultExecutor();
            migrationExecutor = ownedMigrationExecutor;
        } else {
            this.ownedMigrationExecutor = null;
        }
        this.tracker = new PromotionTracker(config.getPromotionThreshold(), config.getPromotionWindow(), clock);
        this.migrator = new TierMigrator(store, tracker, stats, metrics, migrationExecutor, clock,
                config.getHotIdleTimeout(), config.getWarmIdleTimeout(), config.getReaperBatchSize());
        this.reaper = new ExpiryReaper(store, stats, metrics, clock, config.getReaperBatchSize());

        healthChecks.register(new ColdStorageHealthCheck(cold));
        for (Tier tier : store.tiers()) {
            healthChecks.register(new TierCapacityHealthCheck(tier));
        }

        this.maintenance = builder.startMaintenance ? startMaintenance() : null;
        log.info("cache.started codec={} cold={} coldAvailable={} config={}",
                codecs.activeCodec(), cold.storeDescription(), cold.isAvailable(), config);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds the cache for a configuration: a pass-through cache when caching
     * is disabled, a tiered cache otherwise.
     */
    public static CacheFacade create(TieredCacheConfig config) {
        if (!config.isEnabled()) {
            log.info("cache.disabled");
            return new NoOpCacheFacade();
        }
        return builder().config(config).build();
    }

    // ── Lookup and fill ───────────────────────────────────────

    @Override
    public <E extends Exception> byte[] getOrCompute(Map<String, ?> params, Duration ttl, MissFunction<E> fill)
            throws E {
        Objects.requireNonNull(fill, "fill must not be null");
        CacheKey key = keyDeriver.derive(params);
        Duration effectiveTtl = resolveTtl(ttl);

        Optional<byte[]> cached = read(key, true);
        if (cached.isPresent()) {
            return cached.get();
        }

        while (true) {
            CompletableFuture<byte[]> mine = new CompletableFuture<>();
            CompletableFuture<byte[]> leader = inFlight.putIfAbsent(key, mine);
            if (leader == null) {
                return lead(key, effectiveTtl, fill, mine);
            }
            metrics.recordCoalescedFill();
            try {
                return copy(leader.get());
            } catch (ExecutionException | CancellationException e) {
                log.debug("cache.fill.retry key={} reason=leader-failed", key.shortHex());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("cache.fill.wait.interrupted key={}", key.shortHex());
                return fill.compute();
            }
        }
    }

    private <E extends Exception> byte[] lead(CacheKey key, Duration ttl, MissFunction<E> fill,
                                              CompletableFuture<byte[]> marker) throws E {
        try (LogContext ctx = LogContext.forFill(key.shortHex())) {
            Optional<byte[]> raced = read(key, false);
            if (raced.isPresent()) {
                inFlight.remove(key, marker);
                marker.complete(raced.get());
                return raced.get();
            }

            byte[] value;
            long start = System.nanoTime();
            try {
                value = fill.compute();
            } catch (Throwable t) {
                inFlight.remove(key, marker);
                marker.completeExceptionally(t);
                metrics.recordFillFailure();
                log.debug("cache.fill.failed key={} error={}", key.shortHex(), t.toString());
                throw t;
            }
            metrics.recordFill(Duration.ofNanos(System.nanoTime() - start));

            if (value != null) {
                store(key, value, ttl);
            } else {
                log.debug("cache.fill.null key={}", key.shortHex());
            }
            inFlight.remove(key, marker);
            marker.complete(value);
            return value;
        }
    }

    /**
     * Probes the tiers. Undecodable entries are discarded and count as misses.
     *
     * @param record whether the lookup counts towards statistics and promotion
     */
    private Optional<byte[]> read(CacheKey key, boolean record) {
        long start = System.nanoTime();
        Optional<TieredStore.Hit> hit = store.lookup(key, record ? stats::recordProbe : TieredStore.ProbeListener.NONE);
        if (hit.isEmpty()) {
            recordMiss(key, record, start);
            return Optional.empty();
        }

        TieredStore.Hit found = hit.get();
        EncodedPayload payload = found.entry().payload();
        byte[] value;
        try {
            value = payload.isCompressed() ? codecs.decompress(payload) : payload.bytes().clone();
        } catch (CorruptEntryException e) {
            log.warn("cache.entry.corrupt key={} tier={} error={}", key.shortHex(), found.tier(), e.getMessage());
            store.discardCorrupt(key, found.tier());
            recordMiss(key, record, start);
            return Optional.empty();
        }

        if (record) {
            stats.recordLookup(key, true, System.nanoTime() - start);
            metrics.recordHit(found.tier());
            migrator.onHit(key, found.tier());
        }
        return Optional.of(value);
    }

    private void recordMiss(CacheKey key, boolean record, long start) {
        if (record) {
            stats.recordLookup(key, false, System.nanoTime() - start);
            metrics.recordMiss();
        }
    }

    private void store(CacheKey key, byte[] value, Duration ttl) {
        try {
            CacheEntry entry = CacheEntry.create(key, EncodedPayload.raw(value.clone()), clock.instant(), ttl);
            EvictionReport report = store.place(entry);
            if (report.rejected()) {
                log.debug("cache.store.rejected key={} sizeBytes={}", key.shortHex(), value.length);
            }
            migrator.onEvictions(TierKind.HOT, report);
        } catch (RuntimeException e) {
            log.warn("cache.store.failed key={} error={}", key.shortHex(), e.toString(), e);
        }
    }

    // ── Direct operations ─────────────────────────────────────

    @Override
    public void put(Map<String, ?> params, byte[] value, Duration ttl) {
        Objects.requireNonNull(value, "value must not be null");
        CacheKey key = keyDeriver.derive(params);
        migrator.forget(key);
        store(key, value, resolveTtl(ttl));
    }

    @Override
    public boolean invalidate(Map<String, ?> params) {
        CacheKey key = keyDeriver.derive(params);
        migrator.forget(key);
        boolean removed = store.remove(key);
        log.debug("cache.invalidated key={} removed={}", key.shortHex(), removed);
        return removed;
    }

    @Override
    public boolean contains(Map<String, ?> params) {
        return store.isLive(keyDeriver.derive(params), clock.instant());
    }

    /**
     * Tier currently holding the value for the parameters, if any.
     */
    public Optional<TierKind> residency(Map<String, ?> params) {
        return store.residency(keyDeriver.derive(params));
    }

    @Override
    public void clearAll() {
        Map<TierKind, Integer> removed = store.clear();
        migrator.reset();
        stats.reset();
        log.info("cache.cleared removed={}", removed);
    }

    // ── Maintenance ───────────────────────────────────────────

    /**
     * Runs one expiry pass now, independent of the schedule.
     */
    public ReapResult reapNow() {
        return reaper.reap();
    }

    /**
     * Runs one idle-demotion sweep now, independent of the schedule.
     */
    public int sweepNow() {
        return migrator.sweep();
    }

    private ScheduledExecutorService startMaintenance() {
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(
                TierMigrator.daemonThreads("search-cache-maintenance"));
        long reapMillis = config.getReaperInterval().toMillis();
        long sweepMillis = config.getMigrationSweepInterval().toMillis();
        scheduler.scheduleWithFixedDelay(reaper::runScheduled, reapMillis, reapMillis, TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(migrator::runScheduled, sweepMillis, sweepMillis, TimeUnit.MILLISECONDS);
        return scheduler;
    }

    // ── Observation ───────────────────────────────────────────

    @Override
    public StatsSnapshot stats() {
        return stats.snapshot(store.tiers());
    }

    @Override
    public CacheInfo info() {
        Map<TierKind, Integer> entries = new EnumMap<>(TierKind.class);
        Map<TierKind, Long> usage = new EnumMap<>(TierKind.class);
        Map<TierKind, Long> budgets = new EnumMap<>(TierKind.class);
        for (Tier tier : store.tiers()) {
            entries.put(tier.kind(), tier.size());
            usage.put(tier.kind(), tier.currentUsageBytes());
            budgets.put(tier.kind(), tier.budgetBytes());
        }
        ColdTier cold = store.coldTier();
        return new CacheInfo(true, entries, usage, budgets, codecs.activeCodec().name(),
                cold.isAvailable(), cold.storeDescription());
    }

    @Override
    public HealthStatus health() {
        return healthChecks.checkAll();
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    public TieredCacheConfig config() {
        return config;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        shutdown(maintenance);
        shutdown(ownedMigrationExecutor);
        log.info("cache.closed");
    }

    private static void shutdown(ExecutorService executor) {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private Duration resolveTtl(Duration ttl) {
        if (ttl == null) {
            return config.getDefaultTtl();
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return ttl;
    }

    private static byte[] copy(byte[] value) {
        return value == null ? null : value.clone();
    }

    /**
     * Routes events the tiers absorb into statistics and metrics.
     */
    private final class StatsTierListener implements TierListener {

        @Override
        public void onExpired(TierKind tier, CacheKey key) {
            stats.recordExpirations(1);
            metrics.recordExpirations(tier, 1);
        }

        @Override
        public void onCorrupt(TierKind tier, CacheKey key) {
            stats.recordCorruption();
            metrics.recordCorruption(tier);
        }

        @Override
        public void onCompressed(int rawBytes, int compressedBytes) {
            stats.recordCompression(rawBytes, compressedBytes);
        }
    }

    public static class Builder {
        private TieredCacheConfig config = TieredCacheConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private CacheMetrics metrics = new NoOpCacheMetrics();
        private Executor migrationExecutor;
        private ColdStore coldStore;
        private CodecRegistry codecs;
        private boolean startMaintenance = true;

        public Builder config(TieredCacheConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder metrics(CacheMetrics metrics) {
            this.metrics = Objects.requireNonNull(metrics, "metrics");
            return this;
        }

        /**
         * Executor for tier moves. When not set, the cache owns a single worker
         * thread and shuts it down on close.
         */
        public Builder migrationExecutor(Executor migrationExecutor) {
            this.migrationExecutor = migrationExecutor;
            return this;
        }

        /**
         * Storage for the cold tier. Defaults to files under the configured cold directory.
         */
        public Builder coldStore(ColdStore coldStore) {
            this.coldStore = coldStore;
            return this;
        }

        public Builder codecs(CodecRegistry codecs) {
            this.codecs = codecs;
            return this;
        }

        /**
         * Whether to schedule the expiry reaper and idle sweep. Tests turn this
         * off and call {@link TieredCacheFacade#reapNow()} and
         * {@link TieredCacheFacade#sweepNow()} directly.
         */
        public Builder startMaintenance(boolean startMaintenance) {
            this.startMaintenance = startMaintenance;
            return this;
        }

        public TieredCacheFacade build() {
            return new TieredCacheFacade(this);
        }
    }
}
