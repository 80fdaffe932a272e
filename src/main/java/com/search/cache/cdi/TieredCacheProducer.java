package com.search.cache.cdi;

import com.search.cache.api.CacheFacade;
import com.search.cache.api.NoOpCacheFacade;
import com.search.cache.api.TieredCacheConfig;
import com.search.cache.api.TieredCacheFacade;
import com.search.cache.codec.CodecId;
import com.search.cache.metrics.CacheMetrics;
import com.search.cache.metrics.MicrometerCacheMetrics;
import com.search.cache.metrics.NoOpCacheMetrics;
import com.search.cache.migration.ScoringWeights;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * CDI producer that wires the search cache from MicroProfile Config properties.
 *
 * <p>When this class is on the classpath in a CDI container (e.g., Quarkus),
 * it reads configuration from {@code application.yaml} and produces a single
 * application-scoped {@link CacheFacade}. Every property has a default:</p>
 * <pre>
 * search-cache:
 *   enabled: true
 *   default-ttl-seconds: 3600
 *   hot:
 *     budget-mb: 50
 *   cold:
 *     directory: /var/cache/search
 * </pre>
 *
 * <p>When a Micrometer {@link MeterRegistry} bean exists, cache meters are
 * registered on it.</p>
 */
@ApplicationScoped
public class TieredCacheProducer {

    private static final Logger log = LoggerFactory.getLogger(TieredCacheProducer.class);

    // ── General ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "search-cache.enabled", defaultValue = "true")
    boolean enabled;

    @Inject
    @ConfigProperty(name = "search-cache.default-ttl-seconds", defaultValue = "3600")
    long defaultTtlSeconds;

    @Inject
    @ConfigProperty(name = "search-cache.lock-stripes", defaultValue = "64")
    int lockStripes;

    @Inject
    @ConfigProperty(name = "search-cache.hot-key-limit", defaultValue = "20")
    int hotKeyLimit;

    // ── Tier Budgets ──────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "search-cache.hot.budget-mb", defaultValue = "50")
    long hotBudgetMb;

    @Inject
    @ConfigProperty(name = "search-cache.warm.budget-mb", defaultValue = "100")
    long warmBudgetMb;

    @Inject
    @ConfigProperty(name = "search-cache.cold.budget-mb", defaultValue = "500")
    long coldBudgetMb;

    @Inject
    @ConfigProperty(name = "search-cache.cold.directory")
    Optional<String> coldDirectory;

    @Inject
    @ConfigProperty(name = "search-cache.compression.codec", defaultValue = "auto")
    String codec;

    // ── Migration ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "search-cache.promotion.threshold", defaultValue = "3")
    int promotionThreshold;

    @Inject
    @ConfigProperty(name = "search-cache.promotion.window-seconds", defaultValue = "60")
    long promotionWindowSeconds;

    @Inject
    @ConfigProperty(name = "search-cache.migration.sweep-interval-seconds", defaultValue = "30")
    long sweepIntervalSeconds;

    @Inject
    @ConfigProperty(name = "search-cache.migration.hot-idle-seconds", defaultValue = "600")
    long hotIdleSeconds;

    @Inject
    @ConfigProperty(name = "search-cache.migration.warm-idle-seconds", defaultValue = "1800")
    long warmIdleSeconds;

    @Inject
    @ConfigProperty(name = "search-cache.scoring.frequency-weight", defaultValue = "0.7")
    double frequencyWeight;

    @Inject
    @ConfigProperty(name = "search-cache.scoring.recency-weight", defaultValue = "0.3")
    double recencyWeight;

    // ── Expiry ────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "search-cache.reaper.interval-seconds", defaultValue = "60")
    long reaperIntervalSeconds;

    @Inject
    @ConfigProperty(name = "search-cache.reaper.batch-size", defaultValue = "256")
    int reaperBatchSize;

    // ── Metrics ───────────────────────────────────────────────

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public CacheFacade cacheFacade() {
        TieredCacheConfig config = config();
        if (!config.isEnabled()) {
            log.info("Search cache disabled, producing pass-through cache");
            return new NoOpCacheFacade();
        }
        log.info("Producing CacheFacade: {}", config);
        return TieredCacheFacade.builder()
                .config(config)
                .metrics(metrics())
                .build();
    }

    public void closeCache(@Disposes CacheFacade cache) {
        log.info("Closing CacheFacade");
        cache.close();
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    TieredCacheConfig config() {
        TieredCacheConfig.Builder builder = TieredCacheConfig.builder()
                .enabled(enabled)
                .defaultTtl(Duration.ofSeconds(defaultTtlSeconds))
                .lockStripes(lockStripes)
                .hotKeyLimit(hotKeyLimit)
                .hotBudgetBytes(megabytes(hotBudgetMb))
                .warmBudgetBytes(megabytes(warmBudgetMb))
                .coldBudgetBytes(megabytes(coldBudgetMb))
                .preferredCodec(parseCodec(codec))
                .promotionThreshold(promotionThreshold)
                .promotionWindow(Duration.ofSeconds(promotionWindowSeconds))
                .migrationSweepInterval(Duration.ofSeconds(sweepIntervalSeconds))
                .hotIdleTimeout(Duration.ofSeconds(hotIdleSeconds))
                .warmIdleTimeout(Duration.ofSeconds(warmIdleSeconds))
                .scoringWeights(new ScoringWeights(frequencyWeight, recencyWeight))
                .reaperInterval(Duration.ofSeconds(reaperIntervalSeconds))
                .reaperBatchSize(reaperBatchSize);
        coldDirectory.filter(dir -> !dir.isBlank()).ifPresent(dir -> builder.coldDirectory(Path.of(dir)));
        return builder.build();
    }

    private CacheMetrics metrics() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Search cache metrics registered with Micrometer");
            return new MicrometerCacheMetrics(meterRegistry.get());
        }
        return new NoOpCacheMetrics();
    }

    private static long megabytes(long mb) {
        return mb * 1024L * 1024L;
    }

    static CodecId parseCodec(String value) {
        if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value)) {
            return null;
        }
        try {
            return CodecId.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Unknown compression codec '{}', using priority order", value);
            return null;
        }
    }
}
