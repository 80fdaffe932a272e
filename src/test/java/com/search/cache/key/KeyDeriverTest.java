package com.search.cache.key;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Key derivation")
class KeyDeriverTest {

    private final KeyDeriver deriver = new KeyDeriver();

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Same parameters yield the same key")
        void sameParamsSameKey() {
            Map<String, Object> params = Map.of("query", "rust async", "page", 1);
            assertEquals(deriver.derive(params), deriver.derive(params));
        }

        @Test
        @DisplayName("Parameter order does not affect the key")
        void insertionOrderIrrelevant() {
            Map<String, Object> a = new LinkedHashMap<>();
            a.put("query", "rust");
            a.put("language", "en");
            a.put("page", 2);
            Map<String, Object> b = new LinkedHashMap<>();
            b.put("page", 2);
            b.put("language", "en");
            b.put("query", "rust");

            assertEquals(deriver.derive(a), deriver.derive(b));
        }

        @Test
        @DisplayName("Set element order does not affect the key")
        void setOrderIrrelevant() {
            Set<String> first = new LinkedHashSet<>(List.of("google", "bing", "ddg"));
            Set<String> second = new LinkedHashSet<>(List.of("ddg", "google", "bing"));

            assertEquals(deriver.derive(Map.of("engines", first)), deriver.derive(Map.of("engines", second)));
        }

        @Test
        @DisplayName("Equal numbers of different types yield the same key")
        void numericCanonicalization() {
            assertEquals(deriver.derive(Map.of("page", 2)), deriver.derive(Map.of("page", 2L)));
            assertEquals(deriver.derive(Map.of("score", 1.50)), deriver.derive(Map.of("score", 1.5f)));
        }

        @Test
        @DisplayName("Null values map to the same key as the empty string")
        void nullSentinel() {
            Map<String, Object> withNull = new HashMap<>();
            withNull.put("language", null);
            assertEquals(deriver.derive(withNull), deriver.derive(Map.of("language", "")));
        }

        @Test
        @DisplayName("Canonical form is stable across calls")
        void canonicalFormStable() {
            Map<String, Object> params = Map.of("query", "x", "nested", Map.of("b", 1, "a", true));
            assertArrayEquals(deriver.canonicalForm(params), deriver.canonicalForm(params));
        }
    }

    @Nested
    @DisplayName("Distinctness")
    class Distinctness {

        @Test
        @DisplayName("Different values yield different keys")
        void differentValues() {
            assertNotEquals(deriver.derive(Map.of("query", "rust")), deriver.derive(Map.of("query", "go")));
        }

        @Test
        @DisplayName("Type tags separate a number from its string form")
        void typeTagged() {
            assertNotEquals(deriver.derive(Map.of("page", 1)), deriver.derive(Map.of("page", "1")));
        }

        @Test
        @DisplayName("Lists keep their order")
        void listOrderMatters() {
            assertNotEquals(deriver.derive(Map.of("sort", List.of("a", "b"))),
                    deriver.derive(Map.of("sort", List.of("b", "a"))));
        }

        @Test
        @DisplayName("Length prefixes prevent concatenation collisions")
        void noConcatenationCollision() {
            assertNotEquals(deriver.derive(Map.of("a", "bc", "d", "")),
                    deriver.derive(Map.of("a", "b", "d", "c")));
        }

        @Test
        @DisplayName("A missing parameter differs from one set to a value")
        void missingVersusPresent() {
            assertNotEquals(deriver.derive(Map.of("query", "x")),
                    deriver.derive(Map.of("query", "x", "page", 1)));
        }
    }

    @Test
    @DisplayName("Keys are 32 bytes and round-trip through hex")
    void keyShape() {
        CacheKey key = deriver.derive(Map.of("query", "hello"));
        assertEquals(CacheKey.LENGTH, key.toBytes().length);
        assertEquals(64, key.toHex().length());
        assertEquals(key, CacheKey.fromHex(key.toHex()));
        assertEquals(16, key.shortHex().length());
    }

    @Test
    @DisplayName("Null parameter map is rejected")
    void nullParamsRejected() {
        assertThrows(IllegalArgumentException.class, () -> deriver.derive(null));
    }

    @Test
    @DisplayName("Key order is unsigned byte order")
    void unsignedOrder() {
        byte[] low = new byte[CacheKey.LENGTH];
        byte[] high = new byte[CacheKey.LENGTH];
        low[0] = 0x7F;
        high[0] = (byte) 0x80;
        assertTrue(CacheKey.of(low).compareTo(CacheKey.of(high)) < 0);
    }

    @Test
    @DisplayName("Wrong-length key bytes are rejected")
    void wrongLength() {
        assertThrows(IllegalArgumentException.class,
                () -> CacheKey.of("short".getBytes(StandardCharsets.UTF_8)));
    }
}
