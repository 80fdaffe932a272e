package com.search.cache.codec;

/**
 * Pass-through codec for uncompressed payloads.
 */
public class IdentityCodec implements CompressionCodec {

    @Override
    public CodecId id() {
        return CodecId.NONE;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public byte[] compress(byte[] raw) {
        return raw;
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws CorruptEntryException {
        if (compressed.length != rawLength) {
            throw new CorruptEntryException("Raw payload is " + compressed.length
                    + " bytes, expected " + rawLength);
        }
        return compressed;
    }
}
