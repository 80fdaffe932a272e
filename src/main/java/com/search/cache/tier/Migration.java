package com.search.cache.tier;

/**
 * Result of moving one key between tiers.
 *
 * @param from        source tier
 * @param to          destination tier
 * @param moved       whether the key now lives in {@code to}
 * @param destination what the destination's insert evicted; empty when nothing was inserted
 */
public record Migration(TierKind from, TierKind to, boolean moved, EvictionReport destination) {

    public static Migration skipped(TierKind from, TierKind to) {
        return new Migration(from, to, false, EvictionReport.refused());
    }
}
