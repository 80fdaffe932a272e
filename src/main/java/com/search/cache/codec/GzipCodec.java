package com.search.cache.codec;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.zip.Deflater;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * GZIP codec at maximum compression: slowest, highest ratio. Backed by the JDK,
 * so it is always available and ends every fallback chain.
 */
public class GzipCodec implements CompressionCodec {

    @Override
    public CodecId id() {
        return CodecId.GZIP;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public byte[] compress(byte[] raw) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(32, raw.length / 2));
        try (GZIPOutputStream gzip = new GZIPOutputStream(out) {
            {
                def.setLevel(Deflater.BEST_COMPRESSION);
            }
        }) {
            gzip.write(raw);
        } catch (IOException e) {
            // in-memory streams only
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    @Override
    public byte[] decompress(byte[] compressed, int rawLength) throws CorruptEntryException {
        id().checkRawLength(compressed.length, rawLength);
        if (compressed.length < 2
                || compressed[0] != (byte) GZIPInputStream.GZIP_MAGIC
                || compressed[1] != (byte) (GZIPInputStream.GZIP_MAGIC >> 8)) {
            throw new CorruptEntryException("Missing GZIP header");
        }
        try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            byte[] out = gzip.readAllBytes();
            if (out.length != rawLength) {
                throw new CorruptEntryException("GZIP stream decoded to " + out.length
                        + " bytes, expected " + rawLength);
            }
            return out;
        } catch (IOException e) {
            throw new CorruptEntryException("Malformed GZIP stream", e);
        }
    }
}
