package com.search.cache.tier;

import com.search.cache.codec.CorruptEntryException;
import com.search.cache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Compressed tier persisted through a {@link ColdStore}, evicting the
 * least-recently-accessed record first.
 *
 * <p>Only metadata is kept in memory: an index of key, size, expiry and access
 * counters, rebuilt from the store at construction so records survive a restart.
 * Access counters are updated in the index and written back to the record only
 * when the record is rewritten.</p>
 *
 * <p>Any {@link IOException} from the store marks the tier unavailable: every
 * lookup is then a miss and every insert is rejected until {@link #probe()}
 * finds the store healthy again. Deletes that could not reach the store are
 * remembered and applied when the tier recovers, before the index is rebuilt,
 * so a removed or superseded record never comes back.</p>
 */
public class ColdTier implements Tier {
    private static final Logger log = LoggerFactory.getLogger(ColdTier.class);

    private final ColdStore store;
    private final long budgetBytes;
    private final Clock clock;
    private final TierListener listener;

    private final ConcurrentMap<CacheKey, Slot> index = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong usageBytes = new AtomicLong();
    private final Set<CacheKey> pendingDeletes = ConcurrentHashMap.newKeySet();
    private volatile Predicate<CacheKey> heldInMemory = key -> false;
    private volatile boolean available;

    public ColdTier(ColdStore store, long budgetBytes, Clock clock) {
        this(store, budgetBytes, clock, TierListener.NONE);
    }

    public ColdTier(ColdStore store, long budgetBytes, Clock clock, TierListener listener) {
        if (budgetBytes <= 0) {
            throw new IllegalArgumentException("budgetBytes must be > 0");
        }
        this.store = store;
        this.budgetBytes = budgetBytes;
        this.clock = clock;
        this.listener = listener != null ? listener : TierListener.NONE;
        if (store.probe()) {
            this.available = loadIndex();
        } else {
            log.warn("cold.tier.unavailable store={} reason=probe-failed", store.describe());
            this.available = false;
        }
    }

    @Override
    public TierKind kind() {
        return TierKind.COLD;
    }

    public boolean isAvailable() {
        return available;
    }

    public String storeDescription() {
        return store.describe();
    }

    /**
     * Keys the memory tiers currently hold. A record found on disk for such a
     * key while rebuilding the index is stale and gets deleted.
     */
    public void setMemoryResidency(Predicate<CacheKey> heldInMemory) {
        this.heldInMemory = heldInMemory != null ? heldInMemory : key -> false;
    }

    /**
     * Deletes waiting for the store to come back.
     */
    public int pendingDeleteCount() {
        return pendingDeletes.size();
    }

    /**
     * Re-checks the store. A tier that was unavailable and whose store answers
     * again rebuilds its index from the records on disk.
     *
     * @return whether the tier is available after the probe
     */
    public boolean probe() {
        boolean healthy = store.probe();
        if (!healthy) {
            if (available) {
                markUnavailable(new IOException("probe failed"));
            }
            return false;
        }
        if (!available) {
            lock.lock();
            try {
                if (!available && loadIndex()) {
                    available = true;
                    log.info("cold.tier.recovered store={} entries={} usageBytes={}",
                            store.describe(), index.size(), usageBytes.get());
                }
            } finally {
                lock.unlock();
            }
        }
        return available;
    }

    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        if (!available) {
            return Optional.empty();
        }
        Slot slot = index.get(key);
        if (slot == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (slot.isExpired(now)) {
            if (removeIfExpired(key, now)) {
                listener.onExpired(TierKind.COLD, key);
            }
            return Optional.empty();
        }
        Optional<CacheEntry> stored = readRecord(key);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        slot.recordAccess(now);
        CacheEntry entry = stored.get();
        return Optional.of(CacheEntry.restore(key, entry.payload(), entry.createdAt(), entry.ttl(),
                slot.accessCount.get(), Instant.ofEpochMilli(slot.lastAccessedMillis.get()), TierKind.COLD));
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
        if (!incoming.payload().isCompressed()) {
            throw new IllegalArgumentException("Cold tier stores compressed payloads only");
        }
        if (!available) {
            return EvictionReport.refused();
        }
        long size = incoming.sizeBytes();
        if (size > budgetBytes) {
            log.debug("tier.insert.rejected tier=COLD key={} size={} budget={}",
                    incoming.key().shortHex(), size, budgetBytes);
            return EvictionReport.refused();
        }
        lock.lock();
        try {
            Slot existing = index.get(incoming.key());
            long existingSize = existing != null ? existing.sizeBytes : 0;
            long overflow = usageBytes.get() - existingSize + size - budgetBytes;
            List<Slot> victims = overflow > 0 ? selectVictims(overflow, incoming.key()) : List.of();
            if (conditional) {
                for (Slot victim : victims) {
                    if (comparePriority(victim, incoming) >= 0) {
                        return EvictionReport.refused();
                    }
                }
            }
            try {
                store.write(incoming.key(), ColdRecordCodec.encode(incoming));
            } catch (IOException | StorageUnavailableException e) {
                markUnavailable(e);
                return EvictionReport.refused();
            }
            for (Slot victim : victims) {
                removeLocked(victim.key);
            }
            if (existing != null) {
                index.remove(incoming.key());
                usageBytes.addAndGet(-existing.sizeBytes);
            }
            incoming.moveTo(TierKind.COLD);
            index.put(incoming.key(), new Slot(incoming));
            usageBytes.addAndGet(size);
            return EvictionReport.admittedDropping(victims.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the record, returning it when it could still be read. While the
     * store is unavailable the delete is deferred until the tier recovers.
     */
    @Override
    public Optional<CacheEntry> remove(CacheKey key) {
        if (!available && deferDelete(key)) {
            return Optional.empty();
        }
        if (!index.containsKey(key)) {
            return Optional.empty();
        }
        Optional<CacheEntry> stored = available ? readRecord(key) : Optional.empty();
        lock.lock();
        try {
            Slot slot = index.get(key);
            if (slot == null) {
                return Optional.empty();
            }
            removeLocked(key);
            return stored.map(e -> CacheEntry.restore(key, e.payload(), e.createdAt(), e.ttl(),
                    slot.accessCount.get(), Instant.ofEpochMilli(slot.lastAccessedMillis.get()), TierKind.COLD));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes the key whether or not the store is reachable.
     *
     * @return whether the key was indexed
     */
    public boolean discard(CacheKey key) {
        boolean indexed = index.containsKey(key);
        remove(key);
        return indexed;
    }

    /**
     * Queues the delete for recovery if the tier is still unavailable once the
     * lock is held.
     *
     * @return false when the tier recovered meanwhile and the caller must delete directly
     */
    private boolean deferDelete(CacheKey key) {
        lock.lock();
        try {
            if (available) {
                return false;
            }
            pendingDeletes.add(key);
            Slot slot = index.remove(key);
            if (slot != null) {
                usageBytes.addAndGet(-slot.sizeBytes);
            }
            log.debug("cold.delete.deferred key={} indexed={} pending={}",
                    key.shortHex(), slot != null, pendingDeletes.size());
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeIfExpired(CacheKey key, Instant now) {
        lock.lock();
        try {
            Slot slot = index.get(key);
            if (slot == null || !slot.isExpired(now)) {
                return false;
            }
            removeLocked(key);
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean contains(CacheKey key) {
        return available && index.containsKey(key);
    }

    @Override
    public boolean isLive(CacheKey key, Instant now) {
        if (!available) {
            return false;
        }
        Slot slot = index.get(key);
        return slot != null && !slot.isExpired(now);
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
        return index.size();
    }

    @Override
    public Comparator<CacheEntry> evictionOrder(Instant now) {
        return Comparator.comparing(CacheEntry::lastAccessedAt).thenComparing(CacheEntry::key);
    }

    @Override
    public List<CacheKey> expiredKeys(Instant now, int limit) {
        List<CacheKey> expired = new ArrayList<>();
        for (Slot slot : index.values()) {
            if (expired.size() >= limit) {
                break;
            }
            if (slot.isExpired(now)) {
                expired.add(slot.key);
            }
        }
        return expired;
    }

    @Override
    public List<CacheKey> idleKeys(Instant cutoff, int limit) {
        List<CacheKey> idle = new ArrayList<>();
        long cutoffMillis = cutoff.toEpochMilli();
        for (Slot slot : index.values()) {
            if (idle.size() >= limit) {
                break;
            }
            if (slot.lastAccessedMillis.get() < cutoffMillis) {
                idle.add(slot.key);
            }
        }
        return idle;
    }

    /**
     * Drops the index and deletes every record in the store, including records
     * written by an earlier process that were never indexed.
     */
    @Override
    public int clear() {
        lock.lock();
        try {
            int removed = index.size();
            index.clear();
            usageBytes.set(0);
            pendingDeletes.clear();
            try {
                store.deleteAll();
            } catch (IOException | StorageUnavailableException e) {
                markUnavailable(e);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    private Optional<CacheEntry> readRecord(CacheKey key) {
        byte[] record;
        try {
            Optional<byte[]> read = store.read(key);
            if (read.isEmpty()) {
                log.debug("cold.record.missing key={}", key.shortHex());
                forget(key);
                return Optional.empty();
            }
            record = read.get();
        } catch (IOException | StorageUnavailableException e) {
            markUnavailable(e);
            return Optional.empty();
        }
        try {
            return Optional.of(ColdRecordCodec.decode(record, key));
        } catch (CorruptEntryException e) {
            log.warn("cold.record.corrupt key={} reason={}", key.shortHex(), e.getMessage());
            discardCorrupt(key);
            return Optional.empty();
        }
    }

    private void discardCorrupt(CacheKey key) {
        lock.lock();
        try {
            removeLocked(key);
        } finally {
            lock.unlock();
        }
        listener.onCorrupt(TierKind.COLD, key);
    }

    private void forget(CacheKey key) {
        lock.lock();
        try {
            Slot slot = index.remove(key);
            if (slot != null) {
                usageBytes.addAndGet(-slot.sizeBytes);
            }
        } finally {
            lock.unlock();
        }
    }

    private void removeLocked(CacheKey key) {
        Slot slot = index.remove(key);
        if (slot != null) {
            usageBytes.addAndGet(-slot.sizeBytes);
        }
        try {
            store.delete(key);
        } catch (IOException | StorageUnavailableException e) {
            pendingDeletes.add(key);
            markUnavailable(e);
        }
    }

    private List<Slot> selectVictims(long bytesNeeded, CacheKey exclude) {
        // counters are read once per slot so concurrent readers cannot break the sort
        List<Candidate> candidates = new ArrayList<>(index.size());
        for (Slot slot : index.values()) {
            if (!slot.key.equals(exclude)) {
                candidates.add(new Candidate(slot, slot.lastAccessedMillis.get()));
            }
        }
        candidates.sort(Comparator.comparingLong(Candidate::lastAccessedMillis)
                .thenComparing(c -> c.slot().key));
        List<Slot> victims = new ArrayList<>();
        long freed = 0;
        for (Candidate candidate : candidates) {
            if (freed >= bytesNeeded) {
                break;
            }
            victims.add(candidate.slot());
            freed += candidate.slot().sizeBytes;
        }
        return victims;
    }

    private static int comparePriority(Slot slot, CacheEntry incoming) {
        int byRecency = Long.compare(slot.lastAccessedMillis.get(), incoming.lastAccessedAt().toEpochMilli());
        return byRecency != 0 ? byRecency : slot.key.compareTo(incoming.key());
    }

    private boolean loadIndex() {
        index.clear();
        usageBytes.set(0);
        Instant now = clock.instant();
        int corrupt = 0;
        int expired = 0;
        int stale = 0;
        try {
            int applied = applyPendingDeletes();
            for (CacheKey key : store.keys()) {
                if (heldInMemory.test(key)) {
                    store.delete(key);
                    stale++;
                    continue;
                }
                Optional<byte[]> record = store.read(key);
                if (record.isEmpty()) {
                    continue;
                }
                CacheEntry entry;
                try {
                    entry = ColdRecordCodec.decode(record.get(), key);
                } catch (CorruptEntryException e) {
                    store.delete(key);
                    corrupt++;
                    continue;
                }
                if (entry.isExpired(now)) {
                    store.delete(key);
                    expired++;
                    continue;
                }
                index.put(key, new Slot(entry));
                usageBytes.addAndGet(entry.sizeBytes());
            }
            int trimmed = 0;
            if (usageBytes.get() > budgetBytes) {
                for (Slot victim : selectVictims(usageBytes.get() - budgetBytes, null)) {
                    removeLocked(victim.key);
                    trimmed++;
                }
            }
            log.info("cold.index.loaded store={} entries={} usageBytes={} corrupt={} expired={} trimmed={} "
                            + "deferredDeletes={} stale={}",
                    store.describe(), index.size(), usageBytes.get(), corrupt, expired, trimmed, applied, stale);
            return true;
        } catch (IOException | StorageUnavailableException e) {
            log.warn("cold.index.load.failed store={} error={}", store.describe(), e.getMessage());
            index.clear();
            usageBytes.set(0);
            return false;
        }
    }

    private int applyPendingDeletes() throws IOException {
        int applied = 0;
        for (CacheKey key : List.copyOf(pendingDeletes)) {
            store.delete(key);
            pendingDeletes.remove(key);
            applied++;
        }
        return applied;
    }

    private void markUnavailable(Exception cause) {
        if (available) {
            available = false;
            log.warn("cold.tier.unavailable store={} error={}", store.describe(), cause.getMessage());
        }
    }

    /** In-memory index entry; the payload stays in the store. */
    private static final class Slot {
        final CacheKey key;
        final long sizeBytes;
        final long expiresAtMillis;
        final AtomicLong accessCount;
        final AtomicLong lastAccessedMillis;

        Slot(CacheEntry entry) {
            this.key = entry.key();
            this.sizeBytes = entry.sizeBytes();
            this.expiresAtMillis = entry.expiresAt().toEpochMilli();
            this.accessCount = new AtomicLong(entry.accessCount());
            this.lastAccessedMillis = new AtomicLong(entry.lastAccessedAt().toEpochMilli());
        }

        boolean isExpired(Instant now) {
            return now.toEpochMilli() >= expiresAtMillis;
        }

        void recordAccess(Instant now) {
            accessCount.incrementAndGet();
            lastAccessedMillis.accumulateAndGet(now.toEpochMilli(), Math::max);
        }
    }

    private record Candidate(Slot slot, long lastAccessedMillis) {
    }
}
