package com.search.cache.codec;

/**
 * A byte-level compressor. Implementations must round-trip every input,
 * including the empty array, and must be safe for concurrent use.
 */
public interface CompressionCodec {

    CodecId id();

    /**
     * Whether the implementation can run in this JVM (native libraries loaded, etc.).
     */
    boolean isAvailable();

    byte[] compress(byte[] raw);

    /**
     * @param compressed  bytes produced by {@link #compress(byte[])}
     * @param rawLength   length of the original input
     * @throws CorruptEntryException if the bytes cannot be decompressed to {@code rawLength} bytes
     */
    byte[] decompress(byte[] compressed, int rawLength) throws CorruptEntryException;
}
