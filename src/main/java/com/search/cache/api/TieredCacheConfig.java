package com.search.cache.api;

import com.search.cache.codec.CodecId;
import com.search.cache.migration.ScoringWeights;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for a {@link TieredCacheFacade}. Immutable; validated on build.
 */
public class TieredCacheConfig {

    private static final long MB = 1024L * 1024L;

    private static final Duration DEFAULT_TTL = Duration.ofHours(1);
    private static final long DEFAULT_HOT_BUDGET_BYTES = 50 * MB;
    private static final long DEFAULT_WARM_BUDGET_BYTES = 100 * MB;
    private static final long DEFAULT_COLD_BUDGET_BYTES = 500 * MB;
    private static final Duration DEFAULT_REAPER_INTERVAL = Duration.ofSeconds(60);
    private static final int DEFAULT_PROMOTION_THRESHOLD = 3;
    private static final Duration DEFAULT_PROMOTION_WINDOW = Duration.ofSeconds(60);
    private static final Duration DEFAULT_MIGRATION_SWEEP_INTERVAL = Duration.ofSeconds(30);
    private static final Duration DEFAULT_HOT_IDLE_TIMEOUT = Duration.ofMinutes(10);
    private static final Duration DEFAULT_WARM_IDLE_TIMEOUT = Duration.ofMinutes(30);
    private static final int DEFAULT_REAPER_BATCH_SIZE = 256;
    private static final int DEFAULT_HOT_KEY_LIMIT = 20;
    private static final int DEFAULT_LOCK_STRIPES = 64;

    private final boolean enabled;
    private final Duration defaultTtl;
    private final long hotBudgetBytes;
    private final long warmBudgetBytes;
    private final long coldBudgetBytes;
    private final Duration reaperInterval;
    private final int promotionThreshold;
    private final Duration promotionWindow;
    private final Duration migrationSweepInterval;
    private final Duration hotIdleTimeout;
    private final Duration warmIdleTimeout;
    private final int reaperBatchSize;
    private final ScoringWeights scoringWeights;
    private final Path coldDirectory;
    private final CodecId preferredCodec;
    private final int hotKeyLimit;
    private final int lockStripes;

    private TieredCacheConfig(Builder builder) {
        this.enabled = builder.enabled;
        this.defaultTtl = builder.defaultTtl;
        this.hotBudgetBytes = builder.hotBudgetBytes;
        this.warmBudgetBytes = builder.warmBudgetBytes;
        this.coldBudgetBytes = builder.coldBudgetBytes;
        this.reaperInterval = builder.reaperInterval;
        this.promotionThreshold = builder.promotionThreshold;
        this.promotionWindow = builder.promotionWindow;
        this.migrationSweepInterval = builder.migrationSweepInterval;
        this.hotIdleTimeout = builder.hotIdleTimeout;
        this.warmIdleTimeout = builder.warmIdleTimeout;
        this.reaperBatchSize = builder.reaperBatchSize;
        this.scoringWeights = builder.scoringWeights;
        this.coldDirectory = builder.coldDirectory;
        this.preferredCodec = builder.preferredCodec;
        this.hotKeyLimit = builder.hotKeyLimit;
        this.lockStripes = builder.lockStripes;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    public long getHotBudgetBytes() {
        return hotBudgetBytes;
    }

    public long getWarmBudgetBytes() {
        return warmBudgetBytes;
    }

    public long getColdBudgetBytes() {
        return coldBudgetBytes;
    }

    public Duration getReaperInterval() {
        return reaperInterval;
    }

    public int getPromotionThreshold() {
        return promotionThreshold;
    }

    public Duration getPromotionWindow() {
        return promotionWindow;
    }

    public Duration getMigrationSweepInterval() {
        return migrationSweepInterval;
    }

    public Duration getHotIdleTimeout() {
        return hotIdleTimeout;
    }

    public Duration getWarmIdleTimeout() {
        return warmIdleTimeout;
    }

    public int getReaperBatchSize() {
        return reaperBatchSize;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public Path getColdDirectory() {
        return coldDirectory;
    }

    /**
     * @return the preferred codec, or {@code null} to use priority order
     */
    public CodecId getPreferredCodec() {
        return preferredCodec;
    }

    public int getHotKeyLimit() {
        return hotKeyLimit;
    }

    public int getLockStripes() {
        return lockStripes;
    }

    /**
     * Default configuration: 1h TTL, 50MB hot, 100MB warm, 500MB cold under
     * {@code ~/.cache/search-cache}.
     */
    public static TieredCacheConfig defaults() {
        return builder().build();
    }

    /**
     * Configuration for a cache that stores nothing and always calls the fill function.
     */
    public static TieredCacheConfig disabled() {
        return builder().enabled(false).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "TieredCacheConfig{enabled=" + enabled + ", defaultTtl=" + defaultTtl
                + ", hotBudgetBytes=" + hotBudgetBytes + ", warmBudgetBytes=" + warmBudgetBytes
                + ", coldBudgetBytes=" + coldBudgetBytes + ", reaperInterval=" + reaperInterval
                + ", promotionThreshold=" + promotionThreshold + ", promotionWindow=" + promotionWindow
                + ", coldDirectory=" + coldDirectory + ", preferredCodec=" + preferredCodec + "}";
    }

    public static class Builder {
        private boolean enabled = true;
        private Duration defaultTtl = DEFAULT_TTL;
        private long hotBudgetBytes = DEFAULT_HOT_BUDGET_BYTES;
        private long warmBudgetBytes = DEFAULT_WARM_BUDGET_BYTES;
        private long coldBudgetBytes = DEFAULT_COLD_BUDGET_BYTES;
        private Duration reaperInterval = DEFAULT_REAPER_INTERVAL;
        private int promotionThreshold = DEFAULT_PROMOTION_THRESHOLD;
        private Duration promotionWindow = DEFAULT_PROMOTION_WINDOW;
        private Duration migrationSweepInterval = DEFAULT_MIGRATION_SWEEP_INTERVAL;
        private Duration hotIdleTimeout = DEFAULT_HOT_IDLE_TIMEOUT;
        private Duration warmIdleTimeout = DEFAULT_WARM_IDLE_TIMEOUT;
        private int reaperBatchSize = DEFAULT_REAPER_BATCH_SIZE;
        private ScoringWeights scoringWeights = ScoringWeights.defaultWeights();
        private Path coldDirectory = Path.of(System.getProperty("user.home"), ".cache", "search-cache");
        private CodecId preferredCodec;
        private int hotKeyLimit = DEFAULT_HOT_KEY_LIMIT;
        private int lockStripes = DEFAULT_LOCK_STRIPES;

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = requirePositive(defaultTtl, "defaultTtl");
            return this;
        }

        public Builder hotBudgetBytes(long hotBudgetBytes) {
            this.hotBudgetBytes = requirePositive(hotBudgetBytes, "hotBudgetBytes");
            return this;
        }

        public Builder warmBudgetBytes(long warmBudgetBytes) {
            this.warmBudgetBytes = requirePositive(warmBudgetBytes, "warmBudgetBytes");
            return this;
        }

        public Builder coldBudgetBytes(long coldBudgetBytes) {
            this.coldBudgetBytes = requirePositive(coldBudgetBytes, "coldBudgetBytes");
            return this;
        }

        public Builder reaperInterval(Duration reaperInterval) {
            this.reaperInterval = requirePositive(reaperInterval, "reaperInterval");
            return this;
        }

        public Builder promotionThreshold(int promotionThreshold) {
            this.promotionThreshold = (int) requirePositive(promotionThreshold, "promotionThreshold");
            return this;
        }

        public Builder promotionWindow(Duration promotionWindow) {
            this.promotionWindow = requirePositive(promotionWindow, "promotionWindow");
            return this;
        }

        public Builder migrationSweepInterval(Duration migrationSweepInterval) {
            this.migrationSweepInterval = requirePositive(migrationSweepInterval, "migrationSweepInterval");
            return this;
        }

        public Builder hotIdleTimeout(Duration hotIdleTimeout) {
            this.hotIdleTimeout = requirePositive(hotIdleTimeout, "hotIdleTimeout");
            return this;
        }

        public Builder warmIdleTimeout(Duration warmIdleTimeout) {
            this.warmIdleTimeout = requirePositive(warmIdleTimeout, "warmIdleTimeout");
            return this;
        }

        public Builder reaperBatchSize(int reaperBatchSize) {
            this.reaperBatchSize = (int) requirePositive(reaperBatchSize, "reaperBatchSize");
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            if (scoringWeights == null) {
                throw new IllegalArgumentException("scoringWeights must not be null");
            }
            this.scoringWeights = scoringWeights;
            return this;
        }

        public Builder coldDirectory(Path coldDirectory) {
            if (coldDirectory == null) {
                throw new IllegalArgumentException("coldDirectory must not be null");
            }
            this.coldDirectory = coldDirectory;
            return this;
        }

        public Builder preferredCodec(CodecId preferredCodec) {
            this.preferredCodec = preferredCodec == CodecId.NONE ? null : preferredCodec;
            return this;
        }

        public Builder hotKeyLimit(int hotKeyLimit) {
            this.hotKeyLimit = (int) requirePositive(hotKeyLimit, "hotKeyLimit");
            return this;
        }

        public Builder lockStripes(int lockStripes) {
            if (lockStripes <= 0 || Integer.bitCount(lockStripes) != 1) {
                throw new IllegalArgumentException("lockStripes must be a positive power of two");
            }
            this.lockStripes = lockStripes;
            return this;
        }

        public TieredCacheConfig build() {
            return new TieredCacheConfig(this);
        }

        private static long requirePositive(long value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }

        private static Duration requirePositive(Duration value, String name) {
            if (value == null || value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
