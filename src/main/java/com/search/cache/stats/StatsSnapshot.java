package com.search.cache.stats;

import com.search.cache.tier.TierKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Cache statistics at one instant. Each counter is read atomically on its own;
 * the snapshot as a whole is not a cross-counter transaction.
 *
 * @param hits              lookups answered from any tier
 * @param misses            lookups that had to call the fill function
 * @param hitRate           {@code hits / (hits + misses)}, 0 when idle
 * @param avgLatencyMs      mean lookup latency across all tiers probed
 * @param perTierUsageBytes resident bytes per tier
 * @param hotKeys           most frequently accessed keys, most frequent first
 * @param tiers             per-tier detail
 * @param topKeys           the hot keys with their access counts
 * @param promotions        entries moved one tier up
 * @param demotions         entries moved one tier down
 * @param evictions         entries evicted for capacity, all tiers
 * @param expirations       entries dropped after their TTL
 * @param corruptEntries    entries dropped because they failed to decode
 * @param compressionRatio  raw bytes over compressed bytes for everything compressed so far
 */
public record StatsSnapshot(
        long hits,
        long misses,
        double hitRate,
        double avgLatencyMs,
        Map<TierKind, Long> perTierUsageBytes,
        List<String> hotKeys,
        Map<TierKind, TierStats> tiers,
        List<HotKey> topKeys,
        long promotions,
        long demotions,
        long evictions,
        long expirations,
        long corruptEntries,
        double compressionRatio
) {
    public StatsSnapshot {
        perTierUsageBytes = Map.copyOf(perTierUsageBytes);
        hotKeys = List.copyOf(hotKeys);
        tiers = Map.copyOf(tiers);
        topKeys = List.copyOf(topKeys);
    }

    public TierStats tier(TierKind kind) {
        return tiers.getOrDefault(kind, TierStats.empty());
    }

    /**
     * Snapshot of a cache that has never served a lookup.
     */
    public static StatsSnapshot empty() {
        Map<TierKind, Long> usage = new EnumMap<>(TierKind.class);
        Map<TierKind, TierStats> tiers = new EnumMap<>(TierKind.class);
        for (TierKind kind : TierKind.values()) {
            usage.put(kind, 0L);
            tiers.put(kind, TierStats.empty());
        }
        return new StatsSnapshot(0, 0, 0.0, 0.0, usage, List.of(), tiers, List.of(),
                0, 0, 0, 0, 0, 1.0);
    }
}
