package com.search.cache.migration;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.search.cache.key.CacheKey;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counts warm and cold hits per key inside a fixed window that opens at the
 * first hit. A key whose count reaches the threshold inside its window is due
 * for promotion and starts counting afresh.
 *
 * <p>Backed by Caffeine so that windows expire on their own and the table stays
 * bounded. The ticker follows the injected {@link Clock}.</p>
 */
public class PromotionTracker {

    private static final long MAX_TRACKED_KEYS = 100_000;

    private final int threshold;
    private final Cache<CacheKey, AtomicInteger> counters;

    public PromotionTracker(int threshold, Duration window, Clock clock) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0");
        }
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.threshold = threshold;
        this.counters = Caffeine.newBuilder()
                .maximumSize(MAX_TRACKED_KEYS)
                .expireAfterWrite(window)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    /**
     * Counts one hit.
     *
     * @return whether the key just reached the promotion threshold
     */
    public boolean recordHit(CacheKey key) {
        int count = counters.get(key, k -> new AtomicInteger()).incrementAndGet();
        if (count >= threshold) {
            counters.invalidate(key);
            return true;
        }
        return false;
    }

    public int count(CacheKey key) {
        AtomicInteger counter = counters.getIfPresent(key);
        return counter == null ? 0 : counter.get();
    }

    public void forget(CacheKey key) {
        counters.invalidate(key);
    }

    public void clear() {
        counters.invalidateAll();
    }
}
