package com.search.cache.api;

import com.search.cache.tier.TierKind;

import java.util.Map;

/**
 * Static view of the cache's layout and occupancy.
 *
 * @param enabled         false for the pass-through cache
 * @param entries         resident entries per tier
 * @param usageBytes      resident payload bytes per tier
 * @param budgetBytes     configured byte budget per tier
 * @param activeCodec     codec used for new compressed payloads
 * @param coldAvailable   whether cold storage is currently reachable
 * @param coldLocation    where cold records are stored
 */
public record CacheInfo(
        boolean enabled,
        Map<TierKind, Integer> entries,
        Map<TierKind, Long> usageBytes,
        Map<TierKind, Long> budgetBytes,
        String activeCodec,
        boolean coldAvailable,
        String coldLocation
) {
    public CacheInfo {
        entries = Map.copyOf(entries);
        usageBytes = Map.copyOf(usageBytes);
        budgetBytes = Map.copyOf(budgetBytes);
    }

    public int totalEntries() {
        return entries.values().stream().mapToInt(Integer::intValue).sum();
    }

    public long totalUsageBytes() {
        return usageBytes.values().stream().mapToLong(Long::longValue).sum();
    }

    public static CacheInfo disabled() {
        return new CacheInfo(false, Map.of(), Map.of(), Map.of(), "none", false, "");
    }
}
