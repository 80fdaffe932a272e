package com.search.cache.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one cache component, or of the whole cache.
 *
 * <p>The cache never fails its callers because of its own storage, so
 * {@link Status#DEGRADED} is the usual bad state: lookups still answer, with a
 * tier missing or short on room. {@link Status#DOWN} is reserved for checks
 * that could not run at all.</p>
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /** Ordered from best to worst. */
    public enum Status {
        UP,
        DEGRADED,
        DOWN;

        public Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthStatus {
        details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static HealthStatus up() {
        return up("OK");
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, null);
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, null);
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, null);
    }

    /**
     * Copy with one more detail; a detail with the same name is replaced.
     */
    public HealthStatus withDetail(String name, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(name, value);
        return new HealthStatus(status, message, merged);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    /**
     * Whether the cache still answers lookups in this state.
     */
    public boolean isServing() {
        return status != Status.DOWN;
    }
}
