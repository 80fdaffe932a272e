package com.search.cache.codec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority-ordered set of compression codecs, resolved once at construction.
 *
 * <p>The active codec is the preferred one when it is available, otherwise the
 * first available codec in priority order (fast, balanced, high-ratio). Reads
 * always dispatch on the codec id stored with the payload, so switching the
 * active codec never breaks previously written entries.</p>
 */
public class CodecRegistry {
    private static final Logger log = LoggerFactory.getLogger(CodecRegistry.class);

    private final Map<CodecId, CompressionCodec> codecs = new EnumMap<>(CodecId.class);
    private final CompressionCodec active;

    /**
     * @param priority  codecs from most to least preferred; the last one should always be available
     * @param preferred codec to use when available, or {@code null} for priority order
     */
    public CodecRegistry(List<CompressionCodec> priority, CodecId preferred) {
        if (priority == null || priority.isEmpty()) {
            throw new IllegalArgumentException("At least one codec is required");
        }
        IdentityCodec identity = new IdentityCodec();
        codecs.put(identity.id(), identity);
        CompressionCodec firstAvailable = null;
        for (CompressionCodec codec : priority) {
            if (!codec.isAvailable()) {
                log.info("codec.skipped codec={} reason=unavailable", codec.id());
                continue;
            }
            codecs.putIfAbsent(codec.id(), codec);
            if (firstAvailable == null) {
                firstAvailable = codec;
            }
        }
        if (firstAvailable == null) {
            throw new IllegalStateException("No compression codec is available");
        }
        CompressionCodec chosen = firstAvailable;
        if (preferred != null && preferred != CodecId.NONE) {
            CompressionCodec candidate = codecs.get(preferred);
            if (candidate != null) {
                chosen = candidate;
            } else {
                log.warn("codec.preferred.unavailable preferred={} fallback={}", preferred, chosen.id());
            }
        }
        this.active = chosen;
        log.info("codec.selected codec={} available={}", active.id(), codecs.keySet());
    }

    /**
     * Default chain: LZ4, then Zstandard, then GZIP.
     */
    public static CodecRegistry defaults() {
        return withPreference(null);
    }

    public static CodecRegistry withPreference(CodecId preferred) {
        return new CodecRegistry(List.of(new Lz4Codec(), new ZstdCodec(), new GzipCodec()), preferred);
    }

    public CodecId activeCodec() {
        return active.id();
    }

    public boolean isAvailable(CodecId id) {
        return codecs.containsKey(id);
    }

    public Optional<CompressionCodec> codec(CodecId id) {
        return Optional.ofNullable(codecs.get(id));
    }

    /**
     * Compresses with the active codec.
     */
    public EncodedPayload compress(byte[] raw) {
        return new EncodedPayload(active.id(), active.compress(raw), raw.length);
    }

    /**
     * Decompresses with the codec recorded in the payload.
     *
     * @throws CorruptEntryException if the codec is unknown here or the bytes do not decode
     */
    public byte[] decompress(EncodedPayload payload) throws CorruptEntryException {
        CompressionCodec codec = codecs.get(payload.codec());
        if (codec == null) {
            throw new CorruptEntryException("Codec " + payload.codec() + " is not available");
        }
        return codec.decompress(payload.bytes(), payload.rawLength());
    }

    /**
     * Returns the payload in raw form, decompressing when needed.
     */
    public EncodedPayload toRaw(EncodedPayload payload) throws CorruptEntryException {
        if (!payload.isCompressed()) {
            return payload;
        }
        return EncodedPayload.raw(decompress(payload));
    }

    /**
     * Returns the payload in compressed form, compressing raw payloads with the active codec.
     */
    public EncodedPayload toCompressed(EncodedPayload payload) {
        if (payload.isCompressed()) {
            return payload;
        }
        return compress(payload.bytes());
    }
}
