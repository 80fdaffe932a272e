package com.search.cache.tier;

import com.search.cache.key.CacheKey;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Fixed pool of read/write locks selected by key hash. Lookups share a stripe;
 * anything that changes which tier holds a key takes it exclusively.
 *
 * <p>A stripe lock is always taken before a tier lock, and a thread never holds
 * two stripes at once.</p>
 */
public final class KeyStripes {

    private final ReadWriteLock[] locks;
    private final int mask;

    public KeyStripes(int stripes) {
        if (stripes <= 0 || Integer.bitCount(stripes) != 1) {
            throw new IllegalArgumentException("stripes must be a positive power of two");
        }
        this.locks = new ReadWriteLock[stripes];
        for (int i = 0; i < stripes; i++) {
            locks[i] = new ReentrantReadWriteLock();
        }
        this.mask = stripes - 1;
    }

    ReadWriteLock stripeFor(CacheKey key) {
        int h = key.hashCode();
        return locks[(h ^ (h >>> 16)) & mask];
    }

    public <T> T read(CacheKey key, Supplier<T> action) {
        ReadWriteLock lock = stripeFor(key);
        lock.readLock().lock();
        try {
            return action.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public <T> T write(CacheKey key, Supplier<T> action) {
        ReadWriteLock lock = stripeFor(key);
        lock.writeLock().lock();
        try {
            return action.get();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        return locks.length;
    }
}
