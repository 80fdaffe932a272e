package com.search.cache.tier;

/**
 * Thrown when the cold tier's backing storage cannot be read or written.
 * Never escapes the cache: the cold tier answers as a miss until storage recovers.
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
