package com.search.cache.key;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * Fixed-width, immutable cache key derived from every parameter that affects a search result.
 * Produced by {@link KeyDeriver}; equality is byte-wise.
 */
public final class CacheKey implements Comparable<CacheKey> {

    /** Width of every derived key in bytes (SHA-256). */
    public static final int LENGTH = 32;

    private static final HexFormat HEX = HexFormat.of();

    private final byte[] bytes;
    private final int hash;

    private CacheKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    /**
     * Wraps a copy of the given key bytes.
     *
     * @throws IllegalArgumentException if the array is not {@link #LENGTH} bytes long
     */
    public static CacheKey of(byte[] bytes) {
        if (bytes == null || bytes.length != LENGTH) {
            throw new IllegalArgumentException("Cache key must be " + LENGTH + " bytes");
        }
        return new CacheKey(bytes.clone());
    }

    /**
     * Parses the lowercase hex form produced by {@link #toHex()}.
     */
    public static CacheKey fromHex(String hex) {
        return of(HEX.parseHex(hex));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return HEX.formatHex(bytes);
    }

    /**
     * Short prefix of the hex form, used in log lines.
     */
    public String shortHex() {
        return toHex().substring(0, 16);
    }

    /**
     * Unsigned lexicographic byte order; used as the stable eviction tie-break.
     */
    @Override
    public int compareTo(CacheKey other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CacheKey other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return "CacheKey{" + shortHex() + "}";
    }
}
