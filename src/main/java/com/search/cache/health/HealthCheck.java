package com.search.cache.health;

/**
 * Check of one cache component, e.g. cold storage reachability or a tier's
 * budget headroom. Implementations must be cheap: {@code health()} runs every
 * check on each call.
 */
public interface HealthCheck {

    /** Name the result is reported under; unique within a registry. */
    String name();

    HealthStatus check();
}
