package com.search.cache.stats;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.search.cache.key.CacheKey;
import com.search.cache.tier.Tier;
import com.search.cache.tier.TierKind;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.distribution.HistogramSnapshot;
import io.micrometer.core.instrument.distribution.ValueAtPercentile;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free statistics for the cache's own tuning and dashboards.
 *
 * <p>Counters are {@link LongAdder}s; probe latencies go into Micrometer
 * {@link Timer}s on a private {@link SimpleMeterRegistry}, which gives a
 * client-side p99 without exporting anything. Hot keys are counted in a
 * Caffeine-bounded table so a long tail of one-off keys cannot grow it without
 * limit. Recording never blocks; {@link #reset()} swaps in fresh counters.</p>
 */
public class StatsCollector {

    private static final double P99 = 0.99;
    private static final int HOT_KEY_TABLE_FACTOR = 50;

    private final int hotKeyLimit;
    private volatile Counters counters;

    public StatsCollector(int hotKeyLimit) {
        if (hotKeyLimit <= 0) {
            throw new IllegalArgumentException("hotKeyLimit must be > 0");
        }
        this.hotKeyLimit = hotKeyLimit;
        this.counters = new Counters(hotKeyLimit * HOT_KEY_TABLE_FACTOR);
    }

    public void recordProbe(TierKind tier, boolean hit, long nanos) {
        Counters c = counters;
        (hit ? c.tierHits : c.tierMisses).get(tier).increment();
        c.tierLatency.get(tier).record(nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Records the outcome of a whole lookup across tiers.
     */
    public void recordLookup(CacheKey key, boolean hit, long nanos) {
        Counters c = counters;
        (hit ? c.hits : c.misses).increment();
        c.lookupLatency.record(nanos, TimeUnit.NANOSECONDS);
        c.hotKeys.get(key, k -> new LongAdder()).increment();
    }

    public void recordCompression(long rawBytes, long compressedBytes) {
        Counters c = counters;
        c.rawBytes.add(rawBytes);
        c.compressedBytes.add(compressedBytes);
    }

    public void recordEviction(TierKind tier, int count) {
        if (count > 0) {
            counters.evictions.get(tier).add(count);
        }
    }

    public void recordPromotion() {
        counters.promotions.increment();
    }

    public void recordDemotion() {
        counters.demotions.increment();
    }

    public void recordExpirations(long count) {
        if (count > 0) {
            counters.expirations.add(count);
        }
    }

    public void recordCorruption() {
        counters.corrupt.increment();
    }

    public void reset() {
        counters = new Counters(hotKeyLimit * HOT_KEY_TABLE_FACTOR);
    }

    /**
     * Most accessed keys since the last reset, most frequent first. Equal counts
     * are ordered by key.
     */
    public List<HotKey> hotKeys() {
        return counters.hotKeys.asMap().entrySet().stream()
                .map(e -> new HotKey(e.getKey().toHex(), e.getValue().sum()))
                .sorted(Comparator.comparingLong(HotKey::accesses).reversed()
                        .thenComparing(HotKey::key))
                .limit(hotKeyLimit)
                .toList();
    }

    public StatsSnapshot snapshot(List<Tier> tiers) {
        Counters c = counters;
        long hits = c.hits.sum();
        long misses = c.misses.sum();
        long total = hits + misses;

        Map<TierKind, Long> usage = new EnumMap<>(TierKind.class);
        Map<TierKind, TierStats> perTier = new EnumMap<>(TierKind.class);
        long evictions = 0;
        for (Tier tier : tiers) {
            TierKind kind = tier.kind();
            HistogramSnapshot latency = c.tierLatency.get(kind).takeSnapshot();
            long tierEvictions = c.evictions.get(kind).sum();
            evictions += tierEvictions;
            usage.put(kind, tier.currentUsageBytes());
            perTier.put(kind, new TierStats(
                    c.tierHits.get(kind).sum(),
                    c.tierMisses.get(kind).sum(),
                    latency.mean(TimeUnit.MILLISECONDS),
                    p99(latency),
                    tier.currentUsageBytes(),
                    tier.budgetBytes(),
                    tier.size(),
                    tierEvictions));
        }

        List<HotKey> top = hotKeys();
        long compressed = c.compressedBytes.sum();
        double ratio = compressed == 0 ? 1.0 : (double) c.rawBytes.sum() / compressed;

        return new StatsSnapshot(
                hits,
                misses,
                total == 0 ? 0.0 : (double) hits / total,
                c.lookupLatency.mean(TimeUnit.MILLISECONDS),
                usage,
                top.stream().map(HotKey::key).toList(),
                perTier,
                top,
                c.promotions.sum(),
                c.demotions.sum(),
                evictions,
                c.expirations.sum(),
                c.corrupt.sum(),
                ratio);
    }

    private static double p99(HistogramSnapshot snapshot) {
        for (ValueAtPercentile value : snapshot.percentileValues()) {
            if (value.percentile() == P99) {
                return value.value(TimeUnit.MILLISECONDS);
            }
        }
        return 0.0;
    }

    private static final class Counters {
        final LongAdder hits = new LongAdder();
        final LongAdder misses = new LongAdder();
        final LongAdder promotions = new LongAdder();
        final LongAdder demotions = new LongAdder();
        final LongAdder expirations = new LongAdder();
        final LongAdder corrupt = new LongAdder();
        final LongAdder rawBytes = new LongAdder();
        final LongAdder compressedBytes = new LongAdder();
        final Map<TierKind, LongAdder> tierHits = new EnumMap<>(TierKind.class);
        final Map<TierKind, LongAdder> tierMisses = new EnumMap<>(TierKind.class);
        final Map<TierKind, LongAdder> evictions = new EnumMap<>(TierKind.class);
        final Map<TierKind, Timer> tierLatency = new EnumMap<>(TierKind.class);
        final Timer lookupLatency;
        final Cache<CacheKey, LongAdder> hotKeys;

        Counters(int hotKeyCapacity) {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            for (TierKind kind : TierKind.values()) {
                tierHits.put(kind, new LongAdder());
                tierMisses.put(kind, new LongAdder());
                evictions.put(kind, new LongAdder());
                tierLatency.put(kind, Timer.builder("search.cache.tier.latency")
                        .tag("tier", kind.tagValue())
                        .publishPercentiles(P99)
                        .register(registry));
            }
            this.lookupLatency = Timer.builder("search.cache.lookup.latency")
                    .register(registry);
            this.hotKeys = Caffeine.newBuilder()
                    .maximumSize(hotKeyCapacity)
                    .build();
        }
    }
}
