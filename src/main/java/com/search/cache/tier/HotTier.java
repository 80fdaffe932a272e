package com.search.cache.tier;

import com.search.cache.key.CacheKey;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Uncompressed in-process tier with strict least-recently-used eviction.
 */
public class HotTier extends AbstractMemoryTier {

    // access-ordered; eldest first
    private final LinkedHashMap<CacheKey, CacheEntry> recency = new LinkedHashMap<>(64, 0.75f, true);

    public HotTier(long budgetBytes, Clock clock) {
        this(budgetBytes, clock, TierListener.NONE);
    }

    public HotTier(long budgetBytes, Clock clock, TierListener listener) {
        super(budgetBytes, clock, listener);
    }

    @Override
    public TierKind kind() {
        return TierKind.HOT;
    }

    @Override
    protected void checkFormat(CacheEntry entry) {
        if (entry.payload().isCompressed()) {
            throw new IllegalArgumentException("Hot tier stores raw payloads only");
        }
    }

    @Override
    protected void onInsert(CacheEntry entry) {
        recency.put(entry.key(), entry);
    }

    @Override
    protected void onRemove(CacheEntry entry) {
        recency.remove(entry.key());
    }

    @Override
    protected void onAccess(CacheEntry entry) {
        lock.lock();
        try {
            // get() on an access-ordered map moves the key to the tail
            recency.get(entry.key());
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected List<CacheEntry> selectVictims(long bytesNeeded, CacheKey exclude, Instant now) {
        List<CacheEntry> victims = new ArrayList<>();
        long freed = 0;
        for (CacheEntry candidate : recency.values()) {
            if (freed >= bytesNeeded) {
                break;
            }
            if (candidate.key().equals(exclude)) {
                continue;
            }
            victims.add(candidate);
            freed += candidate.sizeBytes();
        }
        return victims;
    }

    @Override
    public Comparator<CacheEntry> evictionOrder(Instant now) {
        return Comparator.comparing(CacheEntry::lastAccessedAt).thenComparing(CacheEntry::key);
    }
}
