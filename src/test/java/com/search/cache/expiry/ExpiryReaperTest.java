package com.search.cache.expiry;

import com.search.cache.codec.CodecRegistry;
import com.search.cache.metrics.NoOpCacheMetrics;
import com.search.cache.migration.EntryScorer;
import com.search.cache.migration.ScoringWeights;
import com.search.cache.stats.StatsCollector;
import com.search.cache.support.Entries;
import com.search.cache.support.MutableClock;
import com.search.cache.tier.CacheEntry;
import com.search.cache.tier.ColdStore;
import com.search.cache.tier.ColdTier;
import com.search.cache.tier.FileSystemColdStore;
import com.search.cache.tier.HotTier;
import com.search.cache.tier.KeyStripes;
import com.search.cache.tier.TierKind;
import com.search.cache.tier.TierListener;
import com.search.cache.tier.TieredStore;
import com.search.cache.tier.WarmTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("ExpiryReaper")
class ExpiryReaperTest {

    @TempDir
    Path dir;

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final CodecRegistry codecs = CodecRegistry.defaults();
    private final StatsCollector stats = new StatsCollector(10);

    private TieredStore store(ColdStore coldStore) {
        return new TieredStore(
                new HotTier(100_000, clock),
                new WarmTier(100_000, new EntryScorer(ScoringWeights.defaultWeights()), clock),
                new ColdTier(coldStore, 1_000_000, clock),
                codecs, new KeyStripes(8), TierListener.NONE);
    }

    private void putCompressed(TieredStore store, TierKind tier, String name, Duration ttl) {
        CacheEntry entry = Entries.raw(name, 200, clock, ttl);
        store.tier(tier).put(entry.withPayload(codecs.compress(entry.payload().bytes())));
    }

    @Test
    @DisplayName("Removes expired entries from every tier and keeps live ones")
    void removesExpiredEverywhere() {
        TieredStore store = store(new FileSystemColdStore(dir));
        store.place(Entries.raw("hot-short", 100, clock, Duration.ofSeconds(30)));
        store.place(Entries.raw("hot-long", 100, clock, Duration.ofHours(2)));
        putCompressed(store, TierKind.WARM, "warm-short", Duration.ofSeconds(30));
        putCompressed(store, TierKind.COLD, "cold-short", Duration.ofSeconds(30));
        ExpiryReaper reaper = new ExpiryReaper(store, stats, new NoOpCacheMetrics(), clock, 16);

        clock.advance(Duration.ofSeconds(31));
        ReapResult result = reaper.reap();

        assertEquals(1, result.removed(TierKind.HOT));
        assertEquals(1, result.removed(TierKind.WARM));
        assertEquals(1, result.removed(TierKind.COLD));
        assertEquals(3, result.totalRemoved());
        assertTrue(result.coldAvailable());
        assertTrue(store.residency(Entries.key("hot-long")).isPresent());
        assertEquals(3, stats.snapshot(store.tiers()).expirations());
    }

    @Test
    @DisplayName("Works through large backlogs in batches")
    void batches() {
        TieredStore store = store(new FileSystemColdStore(dir));
        for (int i = 0; i < 25; i++) {
            store.place(Entries.raw("e" + i, 10, clock, Duration.ofSeconds(1)));
        }
        ExpiryReaper reaper = new ExpiryReaper(store, stats, new NoOpCacheMetrics(), clock, 10);

        clock.advance(Duration.ofSeconds(2));
        ReapResult result = reaper.reap();

        assertEquals(25, result.removed(TierKind.HOT));
        assertEquals(3, result.batches());
        assertEquals(0, store.tier(TierKind.HOT).size());
    }

    @Test
    @DisplayName("Caps the work done in one tick")
    void boundedTick() {
        TieredStore store = store(new FileSystemColdStore(dir));
        for (int i = 0; i < 30; i++) {
            store.place(Entries.raw("e" + i, 10, clock, Duration.ofSeconds(1)));
        }
        ExpiryReaper reaper = new ExpiryReaper(store, stats, new NoOpCacheMetrics(), clock, 5, 2);

        clock.advance(Duration.ofSeconds(2));

        assertEquals(10, reaper.reap().removed(TierKind.HOT));
        assertEquals(20, store.tier(TierKind.HOT).size());
    }

    @Test
    @DisplayName("Nothing to do yields an empty result")
    void idleTick() {
        TieredStore store = store(new FileSystemColdStore(dir));
        ReapResult result = new ExpiryReaper(store, stats, new NoOpCacheMetrics(), clock, 10).reap();

        assertEquals(0, result.totalRemoved());
        assertEquals(0, result.batches());
    }

    @Test
    @DisplayName("Reports cold storage that stopped answering")
    void reportsColdUnavailable() {
        ColdStore coldStore = spy(new FileSystemColdStore(dir));
        TieredStore store = store(coldStore);
        ExpiryReaper reaper = new ExpiryReaper(store, stats, new NoOpCacheMetrics(), clock, 10);

        doReturn(false).when(coldStore).probe();

        assertFalse(reaper.reap().coldAvailable());
        assertFalse(store.coldTier().isAvailable());
    }

    @Test
    @DisplayName("Scheduled runs never throw")
    void scheduledRunContained() {
        TieredStore store = mock(TieredStore.class);
        when(store.coldTier()).thenThrow(new IllegalStateException("boom"));

        assertDoesNotThrow(() -> new ExpiryReaper(store, stats, new NoOpCacheMetrics(), clock, 10).runScheduled());
    }
}
