package com.search.cache.health;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Aggregates component checks. The aggregate takes the worst component status,
 * its message names every component at that status, and its details hold one
 * entry per component. A check that throws reports DOWN.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    /**
     * Adds a check, replacing any registered check with the same name.
     */
    public void register(HealthCheck check) {
        if (check == null) {
            return;
        }
        checks.removeIf(existing -> existing.name().equals(check.name()));
        checks.add(check);
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> components = new LinkedHashMap<>();
        Map<String, HealthStatus> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.name(), result);
            components.put(check.name(), Map.of(
                    "status", result.status().name(),
                    "message", String.valueOf(result.message()),
                    "details", result.details()));
            worst = worst.worse(result.status());
        }

        if (worst == HealthStatus.Status.UP) {
            return new HealthStatus(worst, "OK", components);
        }
        List<String> offenders = new ArrayList<>();
        for (Map.Entry<String, HealthStatus> result : results.entrySet()) {
            if (result.getValue().status() == worst) {
                offenders.add(result.getKey() + ": " + result.getValue().message());
            }
        }
        return new HealthStatus(worst, String.join("; ", offenders), components);
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down("Check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }

    public int size() {
        return checks.size();
    }
}
