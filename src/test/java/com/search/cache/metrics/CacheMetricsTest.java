package com.search.cache.metrics;

import com.search.cache.tier.TierKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CacheMetrics Tests")
class CacheMetricsTest {

    @Nested
    @DisplayName("NoOpCacheMetrics")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpCacheMetrics noOp = new NoOpCacheMetrics();

            assertDoesNotThrow(() -> {
                noOp.recordHit(TierKind.HOT);
                noOp.recordMiss();
                noOp.recordEviction(TierKind.WARM, 3);
                noOp.recordPromotion(TierKind.COLD, TierKind.WARM);
                noOp.recordDemotion(TierKind.HOT, TierKind.WARM);
                noOp.recordCorruption(TierKind.COLD);
                noOp.recordExpirations(TierKind.HOT, 2);
                noOp.recordFill(Duration.ofMillis(5));
                noOp.recordFillFailure();
                noOp.recordCoalescedFill();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerCacheMetrics")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerCacheMetrics metrics = new MicrometerCacheMetrics(registry);

        @Test
        @DisplayName("Hits are counted per tier")
        void hitsPerTier() {
            metrics.recordHit(TierKind.HOT);
            metrics.recordHit(TierKind.HOT);
            metrics.recordHit(TierKind.COLD);

            assertEquals(2.0, registry.get("search.cache.hit").tag("tier", "hot").counter().count());
            assertEquals(1.0, registry.get("search.cache.hit").tag("tier", "cold").counter().count());
        }

        @Test
        @DisplayName("Misses, failures and coalesced fills are plain counters")
        void plainCounters() {
            metrics.recordMiss();
            metrics.recordFillFailure();
            metrics.recordCoalescedFill();
            metrics.recordCoalescedFill();

            assertEquals(1.0, registry.get("search.cache.miss").counter().count());
            assertEquals(1.0, registry.get("search.cache.fill.failure").counter().count());
            assertEquals(2.0, registry.get("search.cache.fill.coalesced").counter().count());
        }

        @Test
        @DisplayName("Movements are tagged with source and destination")
        void movements() {
            metrics.recordPromotion(TierKind.WARM, TierKind.HOT);
            metrics.recordDemotion(TierKind.WARM, TierKind.COLD);

            assertEquals(1.0, registry.get("search.cache.promotion")
                    .tags("from", "warm", "to", "hot").counter().count());
            assertEquals(1.0, registry.get("search.cache.demotion")
                    .tags("from", "warm", "to", "cold").counter().count());
        }

        @Test
        @DisplayName("Evictions and expirations add their counts")
        void countedEvents() {
            metrics.recordEviction(TierKind.WARM, 4);
            metrics.recordExpirations(TierKind.COLD, 7);
            metrics.recordCorruption(TierKind.COLD);

            assertEquals(4.0, registry.get("search.cache.eviction").tag("tier", "warm").counter().count());
            assertEquals(7.0, registry.get("search.cache.expired").tag("tier", "cold").counter().count());
            assertEquals(1.0, registry.get("search.cache.corrupt").tag("tier", "cold").counter().count());
        }

        @Test
        @DisplayName("Fill durations are timed")
        void fillTimer() {
            metrics.recordFill(Duration.ofMillis(120));

            assertEquals(1, registry.get("search.cache.fill.duration").timer().count());
            assertEquals(120.0, registry.get("search.cache.fill.duration").timer().totalTime(TimeUnit.MILLISECONDS),
                    0.001);
        }
    }
}
