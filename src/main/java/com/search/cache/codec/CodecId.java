package com.search.cache.codec;

import java.util.Optional;

/**
 * Identifier of the codec a payload was written with. The numeric id is stored
 * next to every compressed payload, in memory and on disk, so reads never
 * depend on which codec is currently active.
 */
public enum CodecId {
    NONE((byte) 0, 1, 0),
    // a match length byte adds at most 255 output bytes
    LZ4((byte) 1, 255, 16),
    // a 4-byte RLE block expands to one full 128KiB block
    ZSTD((byte) 2, 32_768, 131_072),
    // deflate tops out near 1032:1
    GZIP((byte) 3, 1_032, 1_024);

    private final byte id;
    private final long maxRatio;
    private final long maxOverhead;

    CodecId(byte id, long maxRatio, long maxOverhead) {
        this.id = id;
        this.maxRatio = maxRatio;
        this.maxOverhead = maxOverhead;
    }

    public byte id() {
        return id;
    }

    /**
     * Largest original length this codec can produce from {@code encodedLength} bytes.
     */
    public long maxRawLength(int encodedLength) {
        return encodedLength * maxRatio + maxOverhead;
    }

    /**
     * Rejects a recorded original length that no payload of this size could
     * decode to, before anything is allocated for it.
     *
     * @throws CorruptEntryException if {@code rawLength} is negative or out of reach
     */
    public void checkRawLength(int encodedLength, int rawLength) throws CorruptEntryException {
        if (rawLength < 0) {
            throw new CorruptEntryException("Negative raw length " + rawLength);
        }
        if (rawLength > maxRawLength(encodedLength)) {
            throw new CorruptEntryException(this + " payload of " + encodedLength
                    + " bytes cannot decode to " + rawLength + " bytes");
        }
    }

    public static Optional<CodecId> fromId(byte id) {
        for (CodecId codec : values()) {
            if (codec.id == id) {
                return Optional.of(codec);
            }
        }
        return Optional.empty();
    }
}
