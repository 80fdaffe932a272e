package com.search.cache.expiry;

import com.search.cache.tier.TierKind;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of one reaper tick.
 *
 * @param removed       expired entries removed per tier
 * @param batches       batches processed across all tiers
 * @param elapsed       wall time of the tick
 * @param coldAvailable whether cold storage answered the probe at the start of the tick
 */
public record ReapResult(Map<TierKind, Integer> removed, int batches, Duration elapsed, boolean coldAvailable) {

    public ReapResult {
        removed = Map.copyOf(removed);
    }

    public int totalRemoved() {
        return removed.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int removed(TierKind tier) {
        return removed.getOrDefault(tier, 0);
    }
}
