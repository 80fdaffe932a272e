package com.search.cache.tier;

import java.util.List;

/**
 * Outcome of a tier insert.
 *
 * @param admitted whether the incoming entry is now resident
 * @param evicted  entries removed to make room, in eviction order, with their
 *                 payloads; candidates for demotion
 * @param dropped  entries removed whose payload was not kept in memory (cold
 *                 records), so they cannot be demoted anywhere
 */
public record EvictionReport(boolean admitted, List<CacheEntry> evicted, int dropped) {

    public EvictionReport {
        evicted = evicted == null ? List.of() : List.copyOf(evicted);
        if (dropped < 0) {
            throw new IllegalArgumentException("dropped must be >= 0");
        }
    }

    public static EvictionReport admitted(List<CacheEntry> evicted) {
        return new EvictionReport(true, evicted, 0);
    }

    public static EvictionReport admittedDropping(int dropped) {
        return new EvictionReport(true, List.of(), dropped);
    }

    /**
     * The insert was refused: the entry is larger than the whole budget, the
     * tier's storage is unavailable, or a conditional insert would have displaced
     * entries of equal or higher priority. Nothing was evicted.
     */
    public static EvictionReport refused() {
        return new EvictionReport(false, List.of(), 0);
    }

    public boolean rejected() {
        return !admitted;
    }

    public int evictedCount() {
        return evicted.size() + dropped;
    }
}
