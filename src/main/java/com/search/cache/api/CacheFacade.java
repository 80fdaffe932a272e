package com.search.cache.api;

import com.search.cache.health.HealthStatus;
import com.search.cache.key.SearchQuery;
import com.search.cache.stats.StatsSnapshot;

import java.time.Duration;
import java.util.Map;

/**
 * Entry point to the cache. One instance is built at startup and shared by
 * every caller; there is no global instance.
 *
 * <p>Apart from argument validation, the cache never fails a call on its own
 * account: storage and decoding problems are answered as misses, and only what
 * the caller's {@link MissFunction} throws reaches the caller.</p>
 */
public interface CacheFacade extends AutoCloseable {

    /**
     * Returns the cached value for the parameters, or computes, stores and returns it.
     * Concurrent misses for the same parameters run {@code fill} once.
     *
     * @param params parameters the result depends on; iteration order is irrelevant
     * @param ttl    time to live of a newly stored value, or {@code null} for the default
     * @param fill   computes the value on a miss; never called on a hit
     * @throws E whatever {@code fill} throws, unchanged; nothing is cached in that case
     */
    <E extends Exception> byte[] getOrCompute(Map<String, ?> params, Duration ttl, MissFunction<E> fill) throws E;

    default <E extends Exception> byte[] getOrCompute(Map<String, ?> params, MissFunction<E> fill) throws E {
        return getOrCompute(params, null, fill);
    }

    default <E extends Exception> byte[] getOrCompute(SearchQuery query, Duration ttl, MissFunction<E> fill)
            throws E {
        return getOrCompute(query.toParams(), ttl, fill);
    }

    /**
     * Stores a value directly, replacing any cached value for the parameters.
     *
     * @param ttl time to live, or {@code null} for the default
     */
    void put(Map<String, ?> params, byte[] value, Duration ttl);

    /**
     * Removes the cached value for the parameters from every tier.
     *
     * @return whether a value was cached
     */
    boolean invalidate(Map<String, ?> params);

    /**
     * Whether a live value is cached. Does not count as an access.
     */
    boolean contains(Map<String, ?> params);

    /**
     * Empties every tier, deletes persisted records and resets statistics.
     */
    void clearAll();

    StatsSnapshot stats();

    CacheInfo info();

    HealthStatus health();

    boolean isEnabled();

    /**
     * Stops background maintenance. Cached data on disk is kept.
     */
    @Override
    void close();
}
