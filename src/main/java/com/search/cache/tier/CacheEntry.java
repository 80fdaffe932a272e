package com.search.cache.tier;

import com.search.cache.codec.EncodedPayload;
import com.search.cache.key.CacheKey;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The unit stored in every tier.
 *
 * <p>Identity, payload and expiry are immutable. The access counters only ever
 * grow: {@link #recordAccess(Instant)} never moves {@code lastAccessedAt}
 * backwards, even when called with an older instant from another thread.</p>
 */
public final class CacheEntry {

    private final CacheKey key;
    private final EncodedPayload payload;
    private final Instant createdAt;
    private final Duration ttl;
    private final Instant expiresAt;
    private final AtomicLong accessCount;
    private final AtomicLong lastAccessedMillis;
    private volatile TierKind tier;

    private CacheEntry(CacheKey key, EncodedPayload payload, Instant createdAt, Duration ttl,
                       long accessCount, long lastAccessedMillis, TierKind tier) {
        this.key = Objects.requireNonNull(key, "key");
        this.payload = Objects.requireNonNull(payload, "payload");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.expiresAt = createdAt.plus(ttl);
        this.accessCount = new AtomicLong(accessCount);
        this.lastAccessedMillis = new AtomicLong(lastAccessedMillis);
        this.tier = tier;
    }

    /**
     * A freshly filled entry, not yet accessed.
     */
    public static CacheEntry create(CacheKey key, EncodedPayload payload, Instant now, Duration ttl) {
        return new CacheEntry(key, payload, now, ttl, 0, now.toEpochMilli(), TierKind.HOT);
    }

    /**
     * Rebuilds an entry from persisted state.
     */
    public static CacheEntry restore(CacheKey key, EncodedPayload payload, Instant createdAt, Duration ttl,
                                     long accessCount, Instant lastAccessedAt, TierKind tier) {
        if (accessCount < 0) {
            throw new IllegalArgumentException("accessCount must be >= 0");
        }
        return new CacheEntry(key, payload, createdAt, ttl, accessCount, lastAccessedAt.toEpochMilli(), tier);
    }

    /**
     * Same entry with a re-encoded payload, carrying the current counters over.
     */
    public CacheEntry withPayload(EncodedPayload newPayload) {
        return new CacheEntry(key, newPayload, createdAt, ttl,
                accessCount.get(), lastAccessedMillis.get(), tier);
    }

    public void recordAccess(Instant now) {
        accessCount.incrementAndGet();
        lastAccessedMillis.accumulateAndGet(now.toEpochMilli(), Math::max);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CacheKey key() {
        return key;
    }

    public EncodedPayload payload() {
        return payload;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Duration ttl() {
        return ttl;
    }

    public Instant expiresAt() {
        return expiresAt;
    }

    public long accessCount() {
        return accessCount.get();
    }

    public Instant lastAccessedAt() {
        return Instant.ofEpochMilli(lastAccessedMillis.get());
    }

    public TierKind tier() {
        return tier;
    }

    void moveTo(TierKind tier) {
        this.tier = tier;
    }

    public long sizeBytes() {
        return payload.sizeBytes();
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key.shortHex() + ", tier=" + tier + ", size=" + payload.sizeBytes()
                + ", codec=" + payload.codec() + ", accessCount=" + accessCount.get()
                + ", expiresAt=" + expiresAt + "}";
    }
}
