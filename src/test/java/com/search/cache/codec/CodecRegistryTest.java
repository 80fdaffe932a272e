package com.search.cache.codec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CodecRegistry")
class CodecRegistryTest {

    private static final byte[] VALUE = "search results ".repeat(64).getBytes(StandardCharsets.UTF_8);

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Falls back past unavailable codecs")
        void skipsUnavailable() {
            CompressionCodec broken = mock(CompressionCodec.class);
            when(broken.id()).thenReturn(CodecId.LZ4);
            when(broken.isAvailable()).thenReturn(false);

            CodecRegistry registry = new CodecRegistry(List.of(broken, new GzipCodec()), null);

            assertEquals(CodecId.GZIP, registry.activeCodec());
            assertFalse(registry.isAvailable(CodecId.LZ4));
            verify(broken, never()).compress(any());
        }

        @Test
        @DisplayName("Uses the preferred codec when available")
        void honoursPreference() {
            CodecRegistry registry = CodecRegistry.withPreference(CodecId.GZIP);
            assertEquals(CodecId.GZIP, registry.activeCodec());
        }

        @Test
        @DisplayName("Identity codec is always registered")
        void identityAlwaysPresent() {
            CodecRegistry registry = new CodecRegistry(List.of(new GzipCodec()), null);
            assertTrue(registry.isAvailable(CodecId.NONE));
        }

        @Test
        @DisplayName("Rejects an empty priority list")
        void rejectsEmpty() {
            assertThrows(IllegalArgumentException.class, () -> new CodecRegistry(List.of(), null));
        }
    }

    @Nested
    @DisplayName("Payload conversion")
    class Conversion {

        private final CodecRegistry registry = CodecRegistry.defaults();

        @Test
        @DisplayName("Compressed payloads remember their codec and raw length")
        void compressRecordsCodec() throws CorruptEntryException {
            EncodedPayload payload = registry.compress(VALUE);

            assertEquals(registry.activeCodec(), payload.codec());
            assertEquals(VALUE.length, payload.rawLength());
            assertArrayEquals(VALUE, registry.decompress(payload));
        }

        @Test
        @DisplayName("toRaw and toCompressed leave payloads already in that form alone")
        void conversionsAreIdempotent() throws CorruptEntryException {
            EncodedPayload raw = EncodedPayload.raw(VALUE);
            EncodedPayload compressed = registry.toCompressed(raw);

            assertTrue(compressed.isCompressed());
            assertSame(compressed, registry.toCompressed(compressed));
            assertSame(raw, registry.toRaw(raw));
            assertArrayEquals(VALUE, registry.toRaw(compressed).bytes());
        }

        @Test
        @DisplayName("A payload written with a codec that is not registered is corrupt")
        void unknownCodec() {
            CodecRegistry gzipOnly = new CodecRegistry(List.of(new GzipCodec()), null);
            EncodedPayload foreign = new EncodedPayload(CodecId.ZSTD, new byte[]{1, 2, 3}, 10);

            assertThrows(CorruptEntryException.class, () -> gzipOnly.decompress(foreign));
        }
    }
}
