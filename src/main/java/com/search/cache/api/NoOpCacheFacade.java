package com.search.cache.api;

import com.search.cache.health.HealthStatus;
import com.search.cache.stats.StatsSnapshot;

import java.time.Duration;
import java.util.Map;

/**
 * Pass-through cache used when caching is disabled: every call runs the fill
 * function and nothing is stored.
 */
public class NoOpCacheFacade implements CacheFacade {

    @Override
    public <E extends Exception> byte[] getOrCompute(Map<String, ?> params, Duration ttl, MissFunction<E> fill)
            throws E {
        return fill.compute();
    }

    @Override
    public void put(Map<String, ?> params, byte[] value, Duration ttl) {
        // no-op
    }

    @Override
    public boolean invalidate(Map<String, ?> params) {
        return false;
    }

    @Override
    public boolean contains(Map<String, ?> params) {
        return false;
    }

    @Override
    public void clearAll() {
        // no-op
    }

    @Override
    public StatsSnapshot stats() {
        return StatsSnapshot.empty();
    }

    @Override
    public CacheInfo info() {
        return CacheInfo.disabled();
    }

    @Override
    public HealthStatus health() {
        return HealthStatus.up("Caching disabled");
    }

    @Override
    public boolean isEnabled() {
        return false;
    }

    @Override
    public void close() {
        // no-op
    }
}
