package com.search.cache.tier;

import com.search.cache.key.CacheKey;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A bounded key to entry store with its own byte budget and eviction order.
 *
 * <p>Every implementation keeps {@link #currentUsageBytes()} at or below
 * {@link #budgetBytes()} after each operation, never returns an expired entry,
 * and is safe for concurrent use. Residency across tiers is coordinated by
 * {@link TieredStore}, not by the tiers themselves.</p>
 */
public interface Tier {

    TierKind kind();

    /**
     * Looks up a live entry and records the access. An expired entry is removed
     * and reported as absent.
     */
    Optional<CacheEntry> get(CacheKey key);

    /**
     * Inserts or overwrites, evicting lowest-priority entries first when the
     * budget would otherwise be exceeded.
     */
    EvictionReport put(CacheEntry entry);

    /**
     * Conditional insert used for demotion: admitted only if every entry it would
     * displace has strictly lower priority than the incoming one.
     */
    EvictionReport offer(CacheEntry entry);

    Optional<CacheEntry> remove(CacheKey key);

    /**
     * Residency probe. Does not touch access counters and ignores expiry.
     */
    boolean contains(CacheKey key);

    /**
     * Whether a live (unexpired) entry is resident. Does not touch access counters.
     */
    boolean isLive(CacheKey key, Instant now);

    long currentUsageBytes();

    long budgetBytes();

    int size();

    /**
     * Eviction order of this tier: entries that compare lower are evicted first.
     */
    Comparator<CacheEntry> evictionOrder(Instant now);

    /**
     * Up to {@code limit} keys whose entries are expired at {@code now}. Does not
     * take the tier lock.
     */
    List<CacheKey> expiredKeys(Instant now, int limit);

    /**
     * Removes the entry only if it is still expired at {@code now}.
     *
     * @return whether an entry was removed
     */
    boolean removeIfExpired(CacheKey key, Instant now);

    /**
     * Up to {@code limit} keys last accessed before {@code cutoff}. Does not take the tier lock.
     */
    List<CacheKey> idleKeys(Instant cutoff, int limit);

    /**
     * Removes every entry.
     *
     * @return the number of entries removed
     */
    int clear();
}
