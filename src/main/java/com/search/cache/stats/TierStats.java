package com.search.cache.stats;

/**
 * Point-in-time figures for one tier.
 *
 * @param hits          lookups served by this tier
 * @param misses        lookups that probed this tier and fell through
 * @param avgLatencyMs  mean probe latency
 * @param p99LatencyMs  99th percentile probe latency over the recent window
 * @param usageBytes    resident payload bytes
 * @param budgetBytes   configured budget
 * @param entries       resident entries
 * @param evictions     entries evicted for capacity
 */
public record TierStats(long hits, long misses, double avgLatencyMs, double p99LatencyMs,
                        long usageBytes, long budgetBytes, int entries, long evictions) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }

    public double usageRatio() {
        return budgetBytes == 0 ? 0.0 : (double) usageBytes / budgetBytes;
    }

    public static TierStats empty() {
        return new TierStats(0, 0, 0.0, 0.0, 0, 0, 0, 0);
    }
}
