package com.search.cache.tier;

import com.search.cache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared machinery for the in-process tiers.
 *
 * <p>Entries live in a {@link ConcurrentHashMap} so lookups and background scans
 * never block. Every mutation, together with the subclass's ordering structure
 * and the usage counter, is guarded by one {@link ReentrantLock} per tier.</p>
 */
abstract class AbstractMemoryTier implements Tier {
    private static final Logger log = LoggerFactory.getLogger(AbstractMemoryTier.class);

    protected final ConcurrentMap<CacheKey, CacheEntry> entries = new ConcurrentHashMap<>();
    protected final ReentrantLock lock = new ReentrantLock();
    protected final Clock clock;
    protected final TierListener listener;

    private final long budgetBytes;
    private final AtomicLong usageBytes = new AtomicLong();

    protected AbstractMemoryTier(long budgetBytes, Clock clock, TierListener listener) {
        if (budgetBytes <= 0) {
            throw new IllegalArgumentException("budgetBytes must be > 0");
        }
        this.budgetBytes = budgetBytes;
        this.clock = clock;
        this.listener = listener != null ? listener : TierListener.NONE;
    }

    /**
     * Rejects payloads in the wrong storage format for this tier.
     */
    protected abstract void checkFormat(CacheEntry entry);

    /** Called under the lock after an entry is added. */
    protected abstract void onInsert(CacheEntry entry);

    /** Called under the lock after an entry is removed. */
    protected abstract void onRemove(CacheEntry entry);

    /** Called after a successful lookup. */
    protected abstract void onAccess(CacheEntry entry);

    /**
     * Called under the lock. Returns victims, lowest priority first, whose sizes add
     * up to at least {@code bytesNeeded}, never including {@code exclude}.
     */
    protected abstract List<CacheEntry> selectVictims(long bytesNeeded, CacheKey exclude, Instant now);

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (entry.isExpired(now)) {
            if (removeIfExpired(key, now)) {
                listener.onExpired(kind(), key);
            }
            return Optional.empty();
        }
        entry.recordAccess(now);
        onAccess(entry);
        return Optional.of(entry);
    }

    @Override
    public EvictionReport put(CacheEntry entry) {
        return insert(entry, false);
    }

    @Override
    public EvictionReport offer(CacheEntry entry) {
        return insert(entry, true);
    }

    private EvictionReport insert(CacheEntry incoming, boolean conditional) {
        checkFormat(incoming);
        long size = incoming.sizeBytes();
        if (size > budgetBytes) {
            log.debug("tier.insert.rejected tier={} key={} size={} budget={}",
                    kind(), incoming.key().shortHex(), size, budgetBytes);
            return EvictionReport.refused();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry existing = entries.get(incoming.key());
            long existingSize = existing != null ? existing.sizeBytes() : 0;
            long overflow = usageBytes.get() - existingSize + size - budgetBytes;
            List<CacheEntry> victims = overflow > 0
                    ? selectVictims(overflow, incoming.key(), now)
                    : List.of();
            if (conditional && !victims.isEmpty()) {
                Comparator<CacheEntry> order = evictionOrder(now);
                for (CacheEntry victim : victims) {
                    if (order.compare(victim, incoming) >= 0) {
                        return EvictionReport.refused();
                    }
                }
            }
            for (CacheEntry victim : victims) {
                removeLocked(victim.key());
            }
            if (existing != null) {
                removeLocked(existing.key());
            }
            incoming.moveTo(kind());
            entries.put(incoming.key(), incoming);
            usageBytes.addAndGet(size);
            onInsert(incoming);
            return EvictionReport.admitted(victims);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<CacheEntry> remove(CacheKey key) {
        lock.lock();
        try {
            return Optional.ofNullable(removeLocked(key));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeIfExpired(CacheKey key, Instant now) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null || !entry.isExpired(now)) {
                return false;
            }
            removeLocked(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private CacheEntry removeLocked(CacheKey key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            usageBytes.addAndGet(-removed.sizeBytes());
            onRemove(removed);
        }
        return removed;
    }

    @Override
    public boolean contains(CacheKey key) {
        return entries.containsKey(key);
    }

    @Override
    public boolean isLive(CacheKey key, Instant now) {
        CacheEntry entry = entries.get(key);
        return entry != null && !entry.isExpired(now);
    }

    @Override
    public long currentUsageBytes() {
        return usageBytes.get();
    }

    @Override
    public long budgetBytes() {
        return budgetBytes;
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public List<CacheKey> expiredKeys(Instant now, int limit) {
        List<CacheKey> expired = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (expired.size() >= limit) {
                break;
            }
            if (entry.isExpired(now)) {
                expired.add(entry.key());
            }
        }
        return expired;
    }

    @Override
    public List<CacheKey> idleKeys(Instant cutoff, int limit) {
        List<CacheKey> idle = new ArrayList<>();
        for (CacheEntry entry : entries.values()) {
            if (idle.size() >= limit) {
                break;
            }
            if (entry.lastAccessedAt().isBefore(cutoff)) {
                idle.add(entry.key());
            }
        }
        return idle;
    }

    @Override
    public int clear() {
        lock.lock();
        try {
            int removed = entries.size();
            for (CacheKey key : new ArrayList<>(entries.keySet())) {
                removeLocked(key);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }
}
