package com.search.cache.support;

import com.search.cache.codec.CodecId;
import com.search.cache.codec.CodecRegistry;
import com.search.cache.codec.EncodedPayload;
import com.search.cache.key.CacheKey;
import com.search.cache.key.KeyDeriver;
import com.search.cache.tier.CacheEntry;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Builders for entries used across tier tests.
 */
public final class Entries {

    public static final Duration TTL = Duration.ofHours(1);

    private static final KeyDeriver DERIVER = new KeyDeriver();

    private Entries() {
    }

    public static CacheKey key(String name) {
        return DERIVER.derive(Map.of("query", name));
    }

    public static CacheEntry raw(String name, int sizeBytes, Clock clock) {
        return CacheEntry.create(key(name), EncodedPayload.raw(filled(name, sizeBytes)), clock.instant(), TTL);
    }

    public static CacheEntry raw(String name, int sizeBytes, Clock clock, Duration ttl) {
        return CacheEntry.create(key(name), EncodedPayload.raw(filled(name, sizeBytes)), clock.instant(), ttl);
    }

    public static CacheEntry compressed(String name, int rawSize, CodecRegistry codecs, Clock clock) {
        return CacheEntry.create(key(name), codecs.compress(filled(name, rawSize)), clock.instant(), TTL);
    }

    /**
     * Compressed entry whose payload is exactly {@code sizeBytes} long, for budget arithmetic.
     */
    public static CacheEntry sized(String name, int sizeBytes, Clock clock) {
        return CacheEntry.create(key(name),
                new EncodedPayload(CodecId.GZIP, new byte[sizeBytes], sizeBytes * 4),
                clock.instant(), TTL);
    }

    public static byte[] filled(String seed, int size) {
        byte[] out = new byte[size];
        byte[] pattern = seed.getBytes(StandardCharsets.UTF_8);
        for (int i = 0; i < size; i++) {
            out[i] = pattern.length == 0 ? 0 : pattern[i % pattern.length];
        }
        return out;
    }
}
