package com.search.cache.health;

import com.search.cache.support.Entries;
import com.search.cache.support.MutableClock;
import com.search.cache.tier.ColdStore;
import com.search.cache.tier.ColdTier;
import com.search.cache.tier.FileSystemColdStore;
import com.search.cache.tier.HotTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("Factories set status and message")
        void factories() {
            assertTrue(HealthStatus.up().isUp());
            assertEquals("OK", HealthStatus.up().message());
            assertTrue(HealthStatus.degraded("slow").isDegraded());
            assertTrue(HealthStatus.down("gone").isDown());
        }

        @Test
        @DisplayName("withDetail() returns a copy with the detail added")
        void withDetail() {
            HealthStatus base = HealthStatus.up();
            HealthStatus detailed = base.withDetail("entries", 3);

            assertEquals(3, detailed.details().get("entries"));
            assertTrue(base.details().isEmpty());
        }

        @Test
        @DisplayName("Degraded still serves, down does not")
        void serving() {
            assertTrue(HealthStatus.degraded("cold offline").isServing());
            assertFalse(HealthStatus.down("check failed").isServing());
            assertEquals(HealthStatus.Status.DEGRADED,
                    HealthStatus.Status.UP.worse(HealthStatus.Status.DEGRADED));
            assertEquals(HealthStatus.Status.DOWN,
                    HealthStatus.Status.DOWN.worse(HealthStatus.Status.UP));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        private HealthCheck check(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String name() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }

        @Test
        @DisplayName("Empty registry is UP")
        void emptyIsUp() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("Worst status wins")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("a", HealthStatus.up()));
            registry.register(check("b", HealthStatus.degraded("tight")));

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDegraded());
            assertEquals("b: tight", status.message());
            assertEquals(2, status.details().size());
        }

        @Test
        @DisplayName("Registering a check under a taken name replaces it")
        void sameNameReplaces() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("coldStorage", HealthStatus.degraded("offline")));
            registry.register(check("coldStorage", HealthStatus.up()));

            assertEquals(1, registry.size());
            assertTrue(registry.checkAll().isUp());
        }

        @Test
        @DisplayName("Message names every component at the worst status")
        void messageListsOffenders() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("hotTierCapacity", HealthStatus.degraded("96%")));
            registry.register(check("coldStorage", HealthStatus.up()));
            registry.register(check("warmTierCapacity", HealthStatus.degraded("97%")));

            assertEquals("hotTierCapacity: 96%; warmTierCapacity: 97%", registry.checkAll().message());
        }

        @Test
        @DisplayName("A throwing check counts as DOWN")
        void throwingCheckIsDown() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(check("ok", HealthStatus.up()));
            registry.register(new HealthCheck() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            HealthStatus status = registry.checkAll();

            assertTrue(status.isDown());
            @SuppressWarnings("unchecked")
            Map<String, Object> broken = (Map<String, Object>) status.details().get("broken");
            assertEquals("DOWN", broken.get("status"));
        }
    }

    @Nested
    @DisplayName("Cache checks")
    class CacheChecks {

        @TempDir
        Path dir;

        @Test
        @DisplayName("Cold storage check is UP when the store is reachable")
        void coldStorageUp() {
            ColdTier cold = new ColdTier(new FileSystemColdStore(dir), 1_000, clock);
            HealthStatus status = new ColdStorageHealthCheck(cold).check();

            assertTrue(status.isUp());
            assertEquals(dir.toAbsolutePath().toString(), status.details().get("location"));
        }

        @Test
        @DisplayName("Cold storage check is DEGRADED when the store is unreachable")
        void coldStorageDegraded() {
            ColdStore store = mock(ColdStore.class);
            when(store.probe()).thenReturn(false);
            when(store.describe()).thenReturn("unreachable");

            ColdTier cold = new ColdTier(store, 1_000, clock);
            cold.remove(Entries.key("a"));

            HealthStatus status = new ColdStorageHealthCheck(cold).check();

            assertTrue(status.isDegraded());
            assertEquals(1, status.details().get("pendingDeletes"));
        }

        @Test
        @DisplayName("Capacity check degrades near the budget")
        void capacity() {
            HotTier hot = new HotTier(1_000, clock);
            TierCapacityHealthCheck check = new TierCapacityHealthCheck(hot);
            assertEquals("hotTierCapacity", check.name());

            hot.put(Entries.raw("a", 500, clock));
            assertTrue(check.check().isUp());
            assertEquals(50.0, check.check().details().get("usagePercent"));

            hot.put(Entries.raw("b", 460, clock));
            assertTrue(check.check().isDegraded());
        }
    }
}
