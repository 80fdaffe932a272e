package com.search.cache.tier;

import java.util.Optional;

/**
 * The three storage pools, fastest first.
 */
public enum TierKind {
    HOT,
    WARM,
    COLD;

    /**
     * The next slower tier, used as the demotion target.
     */
    public Optional<TierKind> lower() {
        return switch (this) {
            case HOT -> Optional.of(WARM);
            case WARM -> Optional.of(COLD);
            case COLD -> Optional.empty();
        };
    }

    /**
     * The next faster tier, used as the promotion target.
     */
    public Optional<TierKind> higher() {
        return switch (this) {
            case HOT -> Optional.empty();
            case WARM -> Optional.of(HOT);
            case COLD -> Optional.of(WARM);
        };
    }

    public String tagValue() {
        return name().toLowerCase();
    }
}
