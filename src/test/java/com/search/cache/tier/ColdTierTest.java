package com.search.cache.tier;

import com.search.cache.codec.CodecRegistry;
import com.search.cache.key.CacheKey;
import com.search.cache.support.Entries;
import com.search.cache.support.MutableClock;
import com.search.cache.support.SwitchableColdStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("ColdTier")
class ColdTierTest {

    @TempDir
    Path dir;

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final CodecRegistry codecs = CodecRegistry.defaults();

    @Nested
    @DisplayName("Persistence")
    class Persistence {

        @Test
        @DisplayName("Stored entries decode to the same payload")
        void putAndGet() {
            ColdTier tier = new ColdTier(new FileSystemColdStore(dir), 100_000, clock);
            CacheEntry entry = Entries.compressed("a", 2_000, codecs, clock);

            assertTrue(tier.put(entry).admitted());
            CacheEntry found = tier.get(entry.key()).orElseThrow();

            assertEquals(entry.payload(), found.payload());
            assertEquals(TierKind.COLD, found.tier());
            assertEquals(1, found.accessCount());
            assertEquals(entry.sizeBytes(), tier.currentUsageBytes());
        }

        @Test
        @DisplayName("A new tier over the same directory sees earlier records")
        void survivesRestart() {
            CacheEntry entry = Entries.compressed("a", 2_000, codecs, clock);
            new ColdTier(new FileSystemColdStore(dir), 100_000, clock).put(entry);

            ColdTier reopened = new ColdTier(new FileSystemColdStore(dir), 100_000, clock);

            assertEquals(1, reopened.size());
            assertTrue(reopened.get(entry.key()).isPresent());
        }

        @Test
        @DisplayName("Expired records are deleted when the index loads")
        void expiredDroppedOnLoad() {
            CacheEntry entry = Entries.compressed("a", 2_000, codecs, clock);
            new ColdTier(new FileSystemColdStore(dir), 100_000, clock).put(entry);
            clock.advance(Entries.TTL);

            ColdTier reopened = new ColdTier(new FileSystemColdStore(dir), 100_000, clock);

            assertEquals(0, reopened.size());
            assertFalse(Files.exists(new FileSystemColdStore(dir).pathFor(entry.key())));
        }

        @Test
        @DisplayName("Clear deletes every record")
        void clearDeletesRecords() throws IOException {
            FileSystemColdStore store = new FileSystemColdStore(dir);
            ColdTier tier = new ColdTier(store, 100_000, clock);
            tier.put(Entries.compressed("a", 500, codecs, clock));
            tier.put(Entries.compressed("b", 500, codecs, clock));

            assertEquals(2, tier.clear());
            assertTrue(store.keys().isEmpty());
            assertEquals(0, tier.currentUsageBytes());
        }
    }

    @Nested
    @DisplayName("Corruption")
    class Corruption {

        @Test
        @DisplayName("A damaged record is a miss, is deleted and is reported")
        void corruptRecordIsMiss() throws IOException {
            List<CacheKey> corrupt = new ArrayList<>();
            FileSystemColdStore store = new FileSystemColdStore(dir);
            ColdTier tier = new ColdTier(store, 100_000, clock, new TierListener() {
                @Override
                public void onCorrupt(TierKind kind, CacheKey key) {
                    corrupt.add(key);
                }
            });
            CacheEntry entry = Entries.compressed("a", 2_000, codecs, clock);
            tier.put(entry);

            Path file = store.pathFor(entry.key());
            byte[] bytes = Files.readAllBytes(file);
            bytes[bytes.length / 2] ^= 0x5A;
            Files.write(file, bytes);

            assertTrue(tier.get(entry.key()).isEmpty());
            assertEquals(List.of(entry.key()), corrupt);
            assertFalse(Files.exists(file));
            assertEquals(0, tier.size());
        }

        @Test
        @DisplayName("Damaged records are removed when the index loads")
        void corruptDroppedOnLoad() throws IOException {
            FileSystemColdStore store = new FileSystemColdStore(dir);
            store.write(Entries.key("garbage"), new byte[]{1, 2, 3, 4});

            ColdTier tier = new ColdTier(store, 100_000, clock);

            assertEquals(0, tier.size());
            assertTrue(store.keys().isEmpty());
        }
    }

    @Nested
    @DisplayName("Capacity")
    class Capacity {

        @Test
        @DisplayName("Evicts the least recently accessed record")
        void evictsLeastRecentlyAccessed() {
            ColdTier tier = new ColdTier(new FileSystemColdStore(dir), 250, clock);
            CacheEntry a = Entries.sized("a", 100, clock);
            CacheEntry b = Entries.sized("b", 100, clock);
            tier.put(a);
            tier.put(b);
            clock.advance(Duration.ofSeconds(1));
            tier.get(a.key());

            EvictionReport report = tier.put(Entries.sized("c", 100, clock));

            assertTrue(report.admitted());
            assertEquals(1, report.evictedCount());
            assertTrue(tier.contains(a.key()));
            assertFalse(tier.contains(b.key()));
            assertTrue(tier.currentUsageBytes() <= 250);
        }

        @Test
        @DisplayName("Loading over budget trims the oldest records")
        void trimsOnLoad() {
            ColdTier large = new ColdTier(new FileSystemColdStore(dir), 1_000, clock);
            for (int i = 0; i < 5; i++) {
                large.put(Entries.sized("e" + i, 100, clock));
                clock.advance(Duration.ofSeconds(1));
            }

            ColdTier small = new ColdTier(new FileSystemColdStore(dir), 250, clock);

            assertEquals(2, small.size());
            assertTrue(small.contains(Entries.key("e4")));
            assertTrue(small.contains(Entries.key("e3")));
        }
    }

    @Nested
    @DisplayName("Availability")
    class Availability {

        @Test
        @DisplayName("An unreachable store disables the tier instead of failing")
        void unreachableStore() {
            ColdStore store = mock(ColdStore.class);
            when(store.probe()).thenReturn(false);
            when(store.describe()).thenReturn("mock");

            ColdTier tier = new ColdTier(store, 1_000, clock);

            assertFalse(tier.isAvailable());
            assertTrue(tier.get(Entries.key("a")).isEmpty());
            assertTrue(tier.put(Entries.sized("a", 10, clock)).rejected());
        }

        @Test
        @DisplayName("A read failure marks the tier unavailable and a later probe recovers it")
        void readFailureAndRecovery() throws IOException {
            ColdStore store = mock(ColdStore.class);
            when(store.probe()).thenReturn(true);
            when(store.describe()).thenReturn("mock");
            when(store.keys()).thenReturn(List.of());
            ColdTier tier = new ColdTier(store, 1_000, clock);
            CacheEntry entry = Entries.sized("a", 10, clock);
            tier.put(entry);

            when(store.read(any())).thenThrow(new IOException("disk gone"));
            assertTrue(tier.get(entry.key()).isEmpty());
            assertFalse(tier.isAvailable());

            when(store.keys()).thenReturn(List.of());
            assertTrue(tier.probe());
            assertTrue(tier.isAvailable());
            verify(store, atLeastOnce()).write(eq(entry.key()), any());
        }

        @Test
        @DisplayName("A write failure rejects the insert")
        void writeFailure() throws IOException {
            ColdStore store = mock(ColdStore.class);
            when(store.probe()).thenReturn(true);
            when(store.describe()).thenReturn("mock");
            when(store.keys()).thenReturn(List.of());
            doThrow(new IOException("read-only")).when(store).write(any(), any());
            ColdTier tier = new ColdTier(store, 1_000, clock);

            assertTrue(tier.put(Entries.sized("a", 10, clock)).rejected());
            assertFalse(tier.isAvailable());
            assertEquals(Optional.empty(), tier.get(Entries.key("a")));
        }

        @Test
        @DisplayName("A delete made during an outage is applied when the store comes back")
        void deferredDelete() throws IOException {
            SwitchableColdStore store = new SwitchableColdStore(new FileSystemColdStore(dir));
            ColdTier tier = new ColdTier(store, 100_000, clock);
            CacheEntry entry = Entries.sized("a", 10, clock);
            tier.put(entry);

            store.goDown();
            assertFalse(tier.probe());
            assertTrue(tier.discard(entry.key()));
            assertEquals(1, tier.pendingDeleteCount());

            store.comeBack();
            assertTrue(tier.probe());

            assertEquals(0, tier.size());
            assertEquals(0, tier.pendingDeleteCount());
            assertFalse(tier.contains(entry.key()));
            assertTrue(new FileSystemColdStore(dir).read(entry.key()).isEmpty());
        }

        @Test
        @DisplayName("Removing a key during an outage never fails")
        void removeWhileDown() {
            SwitchableColdStore store = new SwitchableColdStore(new FileSystemColdStore(dir));
            ColdTier tier = new ColdTier(store, 100_000, clock);
            store.goDown();
            tier.probe();

            assertEquals(Optional.empty(), tier.remove(Entries.key("never-stored")));
            assertFalse(tier.discard(Entries.key("never-stored")));
        }

        @Test
        @DisplayName("Recovery drops records for keys that memory tiers now hold")
        void staleRecordDropped() throws IOException {
            SwitchableColdStore store = new SwitchableColdStore(new FileSystemColdStore(dir));
            ColdTier tier = new ColdTier(store, 100_000, clock);
            CacheEntry held = Entries.sized("held", 10, clock);
            CacheEntry other = Entries.sized("other", 10, clock);
            tier.put(held);
            tier.put(other);

            store.goDown();
            tier.probe();
            tier.setMemoryResidency(key -> key.equals(held.key()));
            store.comeBack();
            assertTrue(tier.probe());

            assertFalse(tier.contains(held.key()));
            assertTrue(tier.contains(other.key()));
            assertTrue(new FileSystemColdStore(dir).read(held.key()).isEmpty());
        }

        @Test
        @DisplayName("A failed delete is retried on recovery")
        void failedDeleteRetried() throws IOException {
            ColdStore store = mock(ColdStore.class);
            when(store.probe()).thenReturn(true);
            when(store.describe()).thenReturn("mock");
            when(store.keys()).thenReturn(List.of());
            ColdTier tier = new ColdTier(store, 1_000, clock);
            CacheEntry entry = Entries.sized("a", 10, clock);
            tier.put(entry);
            when(store.delete(any())).thenThrow(new IOException("disk gone"));

            clock.advance(Entries.TTL.plusSeconds(1));
            assertTrue(tier.removeIfExpired(entry.key(), clock.instant()));
            assertFalse(tier.isAvailable());
            assertEquals(1, tier.pendingDeleteCount());

            doReturn(true).when(store).delete(any());
            assertTrue(tier.probe());
            assertEquals(0, tier.pendingDeleteCount());
            verify(store, atLeast(2)).delete(entry.key());
        }
    }
}
