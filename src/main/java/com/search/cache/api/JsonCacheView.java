package com.search.cache.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Typed view over a {@link CacheFacade} that stores values as JSON.
 *
 * <p>A cached value that no longer deserializes into the view's type (for
 * example after the type changed between releases) is treated as a miss: it is
 * invalidated and recomputed.</p>
 *
 * @param <T> the cached value type
 */
public class JsonCacheView<T> {
    private static final Logger log = LoggerFactory.getLogger(JsonCacheView.class);

    /**
     * Computes a typed value on a miss.
     */
    @FunctionalInterface
    public interface Loader<T, E extends Exception> {
        T load() throws E;
    }

    private final CacheFacade cache;
    private final ObjectMapper objectMapper;
    private final JavaType type;

    public JsonCacheView(CacheFacade cache, Class<T> type) {
        this(cache, new ObjectMapper(), type);
    }

    public JsonCacheView(CacheFacade cache, ObjectMapper objectMapper, Class<T> type) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.type = objectMapper.constructType(type);
    }

    public JsonCacheView(CacheFacade cache, ObjectMapper objectMapper, TypeReference<T> type) {
        this.cache = Objects.requireNonNull(cache, "cache");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.type = objectMapper.getTypeFactory().constructType(type);
    }

    public <E extends Exception> T getOrCompute(Map<String, ?> params, Loader<T, E> loader) throws E {
        return getOrCompute(params, null, loader);
    }

    /**
     * Returns the cached value, or loads, stores and returns it.
     *
     * @param ttl time to live of a newly stored value, or {@code null} for the default
     * @throws E whatever {@code loader} throws
     */
    public <E extends Exception> T getOrCompute(Map<String, ?> params, Duration ttl, Loader<T, E> loader) throws E {
        byte[] json = cache.getOrCompute(params, ttl, () -> serialize(loader.load()));
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            log.warn("cache.json.unreadable type={} error={}", type, e.getMessage());
            cache.invalidate(params);
            T value = loader.load();
            if (value != null) {
                cache.put(params, serialize(value), ttl);
            }
            return value;
        }
    }

    public void put(Map<String, ?> params, T value, Duration ttl) {
        cache.put(params, serialize(Objects.requireNonNull(value, "value")), ttl);
    }

    public boolean invalidate(Map<String, ?> params) {
        return cache.invalidate(params);
    }

    private byte[] serialize(T value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value of type " + value.getClass().getName()
                    + " cannot be written as JSON: " + e.getMessage(), e);
        }
    }
}
