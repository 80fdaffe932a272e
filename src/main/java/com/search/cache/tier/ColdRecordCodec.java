package com.search.cache.tier;

import com.search.cache.codec.CodecId;
import com.search.cache.codec.CorruptEntryException;
import com.search.cache.codec.EncodedPayload;
import com.search.cache.key.CacheKey;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Duration;
import java.time.Instant;
import java.util.zip.CRC32;

/**
 * Binary layout of a persisted cold record. Self-describing: the codec id is
 * embedded, so a record stays readable after the active codec changes.
 *
 * <pre>
 * int    magic            'S','T','C','R'
 * byte   version
 * byte   codecId
 * byte[32] key
 * long   createdAt        epoch millis
 * long   ttl              millis
 * long   accessCount
 * long   lastAccessedAt   epoch millis
 * int    rawLength
 * int    payloadLength
 * byte[] payload
 * int    crc32            over every preceding byte
 * </pre>
 */
public final class ColdRecordCodec {

    public static final ByteOrder BYTE_ORDER = ByteOrder.BIG_ENDIAN;

    static final int MAGIC = 0x53544352;
    static final byte VERSION = 1;

    private static final int HEADER_SIZE = 4 + 1 + 1 + CacheKey.LENGTH + 8 + 8 + 8 + 8 + 4 + 4;
    private static final int TRAILER_SIZE = 4;

    private ColdRecordCodec() {}

    public static byte[] encode(CacheEntry entry) {
        EncodedPayload payload = entry.payload();
        byte[] data = payload.bytes();
        ByteBuffer buf = ByteBuffer.allocate(HEADER_SIZE + data.length + TRAILER_SIZE).order(BYTE_ORDER);
        buf.putInt(MAGIC);
        buf.put(VERSION);
        buf.put(payload.codec().id());
        buf.put(entry.key().toBytes());
        buf.putLong(entry.createdAt().toEpochMilli());
        buf.putLong(entry.ttl().toMillis());
        buf.putLong(entry.accessCount());
        buf.putLong(entry.lastAccessedAt().toEpochMilli());
        buf.putInt(payload.rawLength());
        buf.putInt(data.length);
        buf.put(data);
        buf.putInt((int) crc(buf.array(), buf.position()));
        return buf.array();
    }

    /**
     * Parses and verifies a record.
     *
     * @param expectedKey key the record was looked up under; a mismatch is corruption
     */
    public static CacheEntry decode(byte[] record, CacheKey expectedKey) throws CorruptEntryException {
        if (record.length < HEADER_SIZE + TRAILER_SIZE) {
            throw new CorruptEntryException("Record truncated: " + record.length + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(record).order(BYTE_ORDER);
        int bodyLength = record.length - TRAILER_SIZE;
        int storedCrc = buf.getInt(bodyLength);
        if (storedCrc != (int) crc(record, bodyLength)) {
            throw new CorruptEntryException("Record checksum mismatch");
        }
        try {
            if (buf.getInt() != MAGIC) {
                throw new CorruptEntryException("Bad record magic");
            }
            byte version = buf.get();
            if (version != VERSION) {
                throw new CorruptEntryException("Unsupported record version " + version);
            }
            byte codecByte = buf.get();
            CodecId codec = CodecId.fromId(codecByte)
                    .orElseThrow(() -> new CorruptEntryException("Unknown codec id " + codecByte));
            byte[] keyBytes = new byte[CacheKey.LENGTH];
            buf.get(keyBytes);
            CacheKey key = CacheKey.of(keyBytes);
            if (expectedKey != null && !expectedKey.equals(key)) {
                throw new CorruptEntryException("Record holds key " + key.shortHex()
                        + ", expected " + expectedKey.shortHex());
            }
            Instant createdAt = Instant.ofEpochMilli(buf.getLong());
            Duration ttl = Duration.ofMillis(buf.getLong());
            long accessCount = buf.getLong();
            Instant lastAccessedAt = Instant.ofEpochMilli(buf.getLong());
            int rawLength = buf.getInt();
            int payloadLength = buf.getInt();
            if (payloadLength < 0 || payloadLength != bodyLength - HEADER_SIZE) {
                throw new CorruptEntryException("Payload length " + payloadLength + " does not match record size");
            }
            codec.checkRawLength(payloadLength, rawLength);
            byte[] data = new byte[payloadLength];
            buf.get(data);
            return CacheEntry.restore(key, new EncodedPayload(codec, data, rawLength),
                    createdAt, ttl, accessCount, lastAccessedAt, TierKind.COLD);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new CorruptEntryException("Malformed record", e);
        }
    }

    private static long crc(byte[] bytes, int length) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, length);
        return crc.getValue();
    }
}
