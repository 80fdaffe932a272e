package com.search.cache.key;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives a {@link CacheKey} from a parameter map.
 *
 * <p>The map is serialized into a canonical byte form and hashed with SHA-256.
 * The canonical form is independent of map iteration order: keys are sorted
 * lexicographically and every field is length-prefixed and type-tagged, so no
 * delimiter can be forged by a parameter value.</p>
 *
 * <p>Normalization rules:</p>
 * <ul>
 *   <li>{@code null} values are written as the empty string sentinel</li>
 *   <li>integral and decimal numbers share one canonical decimal form
 *       ({@code 1}, {@code 1L} and {@code 1.0} are the same value)</li>
 *   <li>{@link Set} elements are sorted; {@link List} order is kept</li>
 *   <li>nested maps are canonicalized recursively</li>
 *   <li>enums use their name, anything else its {@code toString()}</li>
 * </ul>
 *
 * <p>Instances are stateless and thread-safe.</p>
 */
public final class KeyDeriver {

    static final String NULL_SENTINEL = "";

    private static final byte TAG_STRING = 'S';
    private static final byte TAG_NUMBER = 'N';
    private static final byte TAG_BOOLEAN = 'B';
    private static final byte TAG_LIST = 'L';
    private static final byte TAG_SET = 'U';
    private static final byte TAG_MAP = 'M';

    /**
     * Derives the key for the given parameters. Pure: no I/O, no randomness.
     *
     * @param params query parameters; iteration order is irrelevant
     * @return the 256-bit cache key
     */
    public CacheKey derive(Map<String, ?> params) {
        if (params == null) {
            throw new IllegalArgumentException("params must not be null");
        }
        return CacheKey.of(sha256(canonicalForm(params)));
    }

    /**
     * Returns the canonical byte form that is hashed by {@link #derive(Map)}.
     */
    byte[] canonicalForm(Map<String, ?> params) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(128);
        writeMap(out, params);
        return out.toByteArray();
    }

    private void writeMap(ByteArrayOutputStream out, Map<?, ?> map) {
        TreeMap<String, Object> sorted = new TreeMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("Parameter names must not be null");
            }
            sorted.put(entry.getKey().toString(), entry.getValue());
        }
        out.write(TAG_MAP);
        writeInt(out, sorted.size());
        for (Map.Entry<String, Object> entry : sorted.entrySet()) {
            writeString(out, entry.getKey());
            writeValue(out, entry.getValue());
        }
    }

    private void writeValue(ByteArrayOutputStream out, Object value) {
        if (value == null) {
            out.write(TAG_STRING);
            writeString(out, NULL_SENTINEL);
        } else if (value instanceof CharSequence s) {
            out.write(TAG_STRING);
            writeString(out, s.toString());
        } else if (value instanceof Number n) {
            out.write(TAG_NUMBER);
            writeString(out, canonicalNumber(n));
        } else if (value instanceof Boolean b) {
            out.write(TAG_BOOLEAN);
            out.write(b ? 1 : 0);
        } else if (value instanceof Enum<?> e) {
            out.write(TAG_STRING);
            writeString(out, e.name());
        } else if (value instanceof Map<?, ?> m) {
            writeMap(out, m);
        } else if (value instanceof Set<?> set) {
            List<byte[]> elements = new ArrayList<>(set.size());
            for (Object element : set) {
                ByteArrayOutputStream elementOut = new ByteArrayOutputStream();
                writeValue(elementOut, element);
                elements.add(elementOut.toByteArray());
            }
            elements.sort(Arrays::compareUnsigned);
            out.write(TAG_SET);
            writeInt(out, elements.size());
            elements.forEach(out::writeBytes);
        } else if (value instanceof Collection<?> list) {
            out.write(TAG_LIST);
            writeInt(out, list.size());
            for (Object element : list) {
                writeValue(out, element);
            }
        } else {
            out.write(TAG_STRING);
            writeString(out, value.toString());
        }
    }

    private static String canonicalNumber(Number n) {
        if (n instanceof Double d && (d.isNaN() || d.isInfinite())) {
            return d.toString();
        }
        if (n instanceof Float f && (f.isNaN() || f.isInfinite())) {
            return f.toString();
        }
        BigDecimal decimal = n instanceof BigDecimal bd ? bd : new BigDecimal(n.toString());
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.stripTrailingZeros().toPlainString();
    }

    private static void writeString(ByteArrayOutputStream out, String s) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        writeInt(out, bytes.length);
        out.writeBytes(bytes);
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.writeBytes(ByteBuffer.allocate(Integer.BYTES).putInt(value).array());
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
