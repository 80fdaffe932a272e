package com.search.cache.metrics;

import com.search.cache.tier.TierKind;

import java.time.Duration;

/**
 * Interface for exporting cache metrics to an external monitoring system.
 * The default {@link NoOpCacheMetrics} does nothing, so the cache works without
 * any registry wired in. The cache's own counters live in
 * {@link com.search.cache.stats.StatsCollector}; this interface only mirrors them outward.
 */
public interface CacheMetrics {

    void recordHit(TierKind tier);

    void recordMiss();

    void recordEviction(TierKind tier, int count);

    void recordPromotion(TierKind from, TierKind to);

    void recordDemotion(TierKind from, TierKind to);

    void recordCorruption(TierKind tier);

    void recordExpirations(TierKind tier, long count);

    void recordFill(Duration duration);

    void recordFillFailure();

    void recordCoalescedFill();
}
