package com.search.cache.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * A value as stored by a tier: the bytes, the codec that produced them and the
 * length of the original value. {@link CodecId#NONE} means the bytes are raw.
 */
public final class EncodedPayload {

    private final CodecId codec;
    private final byte[] bytes;
    private final int rawLength;

    public EncodedPayload(CodecId codec, byte[] bytes, int rawLength) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.bytes = Objects.requireNonNull(bytes, "bytes");
        if (rawLength < 0) {
            throw new IllegalArgumentException("rawLength must be >= 0");
        }
        if (codec == CodecId.NONE && bytes.length != rawLength) {
            throw new IllegalArgumentException("raw payload length mismatch");
        }
        this.rawLength = rawLength;
    }

    public static EncodedPayload raw(byte[] value) {
        return new EncodedPayload(CodecId.NONE, value, value.length);
    }

    public CodecId codec() {
        return codec;
    }

    /**
     * Returns the stored bytes. Not copied: callers must not mutate them.
     */
    public byte[] bytes() {
        return bytes;
    }

    public int rawLength() {
        return rawLength;
    }

    public int sizeBytes() {
        return bytes.length;
    }

    public boolean isCompressed() {
        return codec != CodecId.NONE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EncodedPayload other)) return false;
        return codec == other.codec && rawLength == other.rawLength && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(codec, rawLength) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "EncodedPayload{codec=" + codec + ", size=" + bytes.length + ", rawLength=" + rawLength + "}";
    }
}
