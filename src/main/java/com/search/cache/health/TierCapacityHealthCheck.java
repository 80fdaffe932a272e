package com.search.cache.health;

import com.search.cache.tier.Tier;

/**
 * Reports tier fill level; DEGRADED once a tier is nearly at its byte budget,
 * since every further insert will then evict.
 */
public class TierCapacityHealthCheck implements HealthCheck {

    static final double DEGRADED_THRESHOLD = 0.95;

    private final Tier tier;

    public TierCapacityHealthCheck(Tier tier) {
        this.tier = tier;
    }

    @Override
    public String name() {
        return tier.kind().tagValue() + "TierCapacity";
    }

    @Override
    public HealthStatus check() {
        long usage = tier.currentUsageBytes();
        long budget = tier.budgetBytes();
        double ratio = budget > 0 ? (double) usage / budget : 0.0;

        HealthStatus base = ratio >= DEGRADED_THRESHOLD
                ? HealthStatus.degraded("Tier usage high: " + String.format("%.1f%%", ratio * 100))
                : HealthStatus.up();

        return base
                .withDetail("usageBytes", usage)
                .withDetail("budgetBytes", budget)
                .withDetail("usagePercent", Math.round(ratio * 1000.0) / 10.0)
                .withDetail("entries", tier.size());
    }
}
