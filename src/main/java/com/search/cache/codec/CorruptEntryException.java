package com.search.cache.codec;

/**
 * Thrown when a cached payload or persisted record cannot be decoded.
 * Never surfaced to cache callers: the owning tier evicts the entry and
 * reports a miss instead.
 */
public class CorruptEntryException extends Exception {

    public CorruptEntryException(String message) {
        super(message);
    }

    public CorruptEntryException(String message, Throwable cause) {
        super(message, cause);
    }
}
