package com.search.cache.tier;

import com.search.cache.key.CacheKey;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Secondary storage for cold records, one opaque record per key.
 * Implementations must make {@link #write} atomic per key: a concurrent or
 * interrupted write never leaves a half-written record behind.
 */
public interface ColdStore {

    void write(CacheKey key, byte[] record) throws IOException;

    Optional<byte[]> read(CacheKey key) throws IOException;

    boolean delete(CacheKey key) throws IOException;

    /**
     * Keys of every stored record.
     */
    List<CacheKey> keys() throws IOException;

    /**
     * Deletes every record.
     *
     * @return the number of records deleted
     */
    int deleteAll() throws IOException;

    /**
     * Checks that the storage is reachable and writable.
     */
    boolean probe();

    /**
     * Human-readable location for logs and health details.
     */
    String describe();
}
