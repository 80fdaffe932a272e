package com.search.cache.codec;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zstandard codec: balanced speed and ratio. Needs zstd-jni's native library;
 * reported unavailable when it cannot be loaded on this platform.
 */
public class ZstdCodec implements CompressionCodec {
    private static final Logger log = LoggerFactory.getLogger(ZstdCodec.class);

    private static final int DEFAULT_LEVEL = 3;

    private final int level;
    private final boolean available;

    public ZstdCodec() {
        this(DEFAULT_LEVEL);
    }

    public ZstdCodec(int level) {
        this.level = level;
        this.available = probe();
    }

    private static boolean probe() {
        try {
            byte[] sample = {1, 2, 3};
            byte[] roundTrip = Zstd.decompress(Zstd.compress(sample), sample.length);
            return roundTrip.length == sample.length;
        } catch (LinkageError | RuntimeException e) {
            log.warn("codec.unavailable codec=zstd reason={}", e.toString());
            return false;
        }
    }

    @Override
    public CodecId id() {
        return CodecId.ZSTD;
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public byte[] compress(byte[] raw) {
        if (raw.length == 0) {
            return raw;
        }
        return Zstd.compress(raw, level);
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws CorruptEntryException {
        id().checkRawLength(compressed.length, rawLength);
        if (rawLength == 0) {
            if (compressed.length != 0) {
                throw new CorruptEntryException("Non-empty zstd frame for empty value");
            }
            return compressed;
        }
        try {
            byte[] out = Zstd.decompress(compressed, rawLength);
            if (out.length != rawLength) {
                throw new CorruptEntryException("zstd frame decoded to " + out.length
                        + " bytes, expected " + rawLength);
            }
            return out;
        } catch (ZstdException e) {
            throw new CorruptEntryException("Malformed zstd frame", e);
        } catch (RuntimeException e) {
            throw new CorruptEntryException("zstd decompression failed", e);
        }
    }
}
