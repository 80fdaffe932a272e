package com.search.cache.tier;

import com.search.cache.key.CacheKey;

/**
 * Callback for events a tier absorbs internally instead of reporting to the caller.
 */
public interface TierListener {

    TierListener NONE = new TierListener() {
    };

    /** An expired entry was dropped during a lookup. */
    default void onExpired(TierKind tier, CacheKey key) {
    }

    /** A stored entry could not be decoded and was deleted. */
    default void onCorrupt(TierKind tier, CacheKey key) {
    }

    /** A raw payload was compressed on its way into a compressed tier. */
    default void onCompressed(int rawBytes, int compressedBytes) {
    }
}
