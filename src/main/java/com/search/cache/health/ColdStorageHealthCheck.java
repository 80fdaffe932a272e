package com.search.cache.health;

import com.search.cache.tier.ColdTier;

/**
 * Reports DEGRADED while the cold tier's storage is unreachable. The cache
 * keeps serving from memory, so this never reports DOWN.
 */
public class ColdStorageHealthCheck implements HealthCheck {

    private final ColdTier coldTier;

    public ColdStorageHealthCheck(ColdTier coldTier) {
        this.coldTier = coldTier;
    }

    @Override
    public String name() {
        return "coldStorage";
    }

    @Override
    public HealthStatus check() {
        HealthStatus base = coldTier.isAvailable()
                ? HealthStatus.up()
                : HealthStatus.degraded("Cold storage unavailable, serving from memory tiers only");
        return base
                .withDetail("location", coldTier.storeDescription())
                .withDetail("entries", coldTier.size())
                .withDetail("usageBytes", coldTier.currentUsageBytes())
                .withDetail("pendingDeletes", coldTier.pendingDeleteCount());
    }
}
