package com.search.cache.codec;

import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * LZ4 block codec: fastest, lowest ratio. Uses the native binding when present
 * and lz4-java's pure Java port otherwise.
 */
public class Lz4Codec implements CompressionCodec {
    private static final Logger log = LoggerFactory.getLogger(Lz4Codec.class);

    private final LZ4Factory factory;

    public Lz4Codec() {
        LZ4Factory resolved = null;
        try {
            resolved = LZ4Factory.fastestInstance();
        } catch (LinkageError e) {
            log.warn("codec.unavailable codec=lz4 reason={}", e.toString());
        }
        this.factory = resolved;
    }

    @Override
    public CodecId id() {
        return CodecId.LZ4;
    }

    @Override
    public boolean isAvailable() {
        return factory != null;
    }

    @Override
    public byte[] compress(byte[] raw) {
        if (raw.length == 0) {
            return raw;
        }
        return factory.fastCompressor().compress(raw);
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws CorruptEntryException {
        id().checkRawLength(compressed.length, rawLength);
        if (rawLength == 0) {
            if (compressed.length != 0) {
                throw new CorruptEntryException("Non-empty LZ4 block for empty value");
            }
            return compressed;
        }
        try {
            byte[] out = new byte[rawLength];
            int written = factory.safeDecompressor()
                    .decompress(compressed, 0, compressed.length, out, 0, rawLength);
            if (written != rawLength) {
                throw new CorruptEntryException("LZ4 block decoded to " + written
                        + " bytes, expected " + rawLength);
            }
            return out;
        } catch (LZ4Exception e) {
            throw new CorruptEntryException("Malformed LZ4 block", e);
        }
    }
}
