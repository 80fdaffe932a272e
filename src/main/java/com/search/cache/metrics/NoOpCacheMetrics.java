package com.search.cache.metrics;

import com.search.cache.tier.TierKind;

import java.time.Duration;

/**
 * No-op implementation of {@link CacheMetrics}.
 */
public class NoOpCacheMetrics implements CacheMetrics {

    @Override
    public void recordHit(TierKind tier) {
    }

    @Override
    public void recordMiss() {
    }

    @Override
    public void recordEviction(TierKind tier, int count) {
    }

    @Override
    public void recordPromotion(TierKind from, TierKind to) {
    }

    @Override
    public void recordDemotion(TierKind from, TierKind to) {
    }

    @Override
    public void recordCorruption(TierKind tier) {
    }

    @Override
    public void recordExpirations(TierKind tier, long count) {
    }

    @Override
    public void recordFill(Duration duration) {
    }

    @Override
    public void recordFillFailure() {
    }

    @Override
    public void recordCoalescedFill() {
    }
}
