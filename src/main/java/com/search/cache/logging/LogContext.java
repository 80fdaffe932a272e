package com.search.cache.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scoped MDC entries for cache operations. Entries set by a context are
 * removed on close; an entry that already had a value when the context opened
 * (a fill running inside a caller's own {@code operation} scope, say) gets that
 * value back.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forFill(key.shortHex())) {
 *     log.debug("cache.fill.started");
 * }
 * </pre>
 */
public final class LogContext implements AutoCloseable {

    public static final String CACHE_KEY = "cacheKey";
    public static final String OPERATION = "operation";

    private static final String FILL = "fill";

    // key -> value before this context set it, null when absent
    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    /**
     * Context around a miss fill for one key.
     */
    public static LogContext forFill(String cacheKey) {
        return new LogContext()
                .with(CACHE_KEY, cacheKey)
                .with(OPERATION, FILL);
    }

    /**
     * Context around one background pass, e.g. {@code reap} or {@code migrate-sweep}.
     */
    public static LogContext forSweep(String operation) {
        return new LogContext().with(OPERATION, operation);
    }

    public LogContext with(String key, String value) {
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
        return this;
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
