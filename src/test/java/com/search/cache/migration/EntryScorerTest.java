package com.search.cache.migration;

import com.search.cache.support.Entries;
import com.search.cache.support.MutableClock;
import com.search.cache.tier.CacheEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Entry scoring")
class EntryScorerTest {

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");

    @Nested
    @DisplayName("ScoringWeights")
    class Weights {

        @Test
        @DisplayName("Weights must be non-negative and sum to one")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(-0.1, 1.1));
            assertThrows(IllegalArgumentException.class, () -> new ScoringWeights(0.5, 0.6));
            assertDoesNotThrow(() -> new ScoringWeights(0.25, 0.75));
        }

        @Test
        @DisplayName("Presets")
        void presets() {
            assertEquals(0.7, ScoringWeights.defaultWeights().frequencyWeight(), 1e-9);
            assertEquals(1.0, ScoringWeights.frequencyOnly().frequencyWeight(), 1e-9);
            assertEquals(1.0, ScoringWeights.recencyOnly().recencyWeight(), 1e-9);
        }
    }

    @Test
    @DisplayName("Blends access rate and recency")
    void blendedScore() {
        EntryScorer scorer = new EntryScorer(ScoringWeights.defaultWeights());
        CacheEntry entry = Entries.raw("a", 10, clock);
        clock.advance(Duration.ofSeconds(10));
        entry.recordAccess(clock.instant());
        entry.recordAccess(clock.instant());
        clock.advance(Duration.ofSeconds(10));

        // 2 accesses over 20s, last one 10s ago
        double expected = 0.7 * (2.0 / 20.0) + 0.3 * (1.0 / 11.0);
        assertEquals(expected, scorer.score(entry, clock.instant()), 1e-9);
    }

    @Test
    @DisplayName("Age is floored at one second")
    void minimumAge() {
        EntryScorer scorer = new EntryScorer(ScoringWeights.frequencyOnly());
        CacheEntry entry = Entries.raw("a", 10, clock);
        entry.recordAccess(clock.instant());

        assertEquals(1.0, scorer.score(entry, clock.instant()), 1e-9);
    }

    @Test
    @DisplayName("Recency-only scoring orders by last access")
    void recencyOnlyOrdering() {
        EntryScorer scorer = new EntryScorer(ScoringWeights.recencyOnly());
        CacheEntry older = Entries.raw("older", 10, clock);
        clock.advance(Duration.ofSeconds(30));
        CacheEntry newer = Entries.raw("newer", 10, clock);
        Instant now = clock.instant().plusSeconds(5);

        assertTrue(scorer.comparator(now).compare(older, newer) < 0);
    }

    @Test
    @DisplayName("Equal scores fall back to key order")
    void tieBreak() {
        EntryScorer scorer = new EntryScorer(ScoringWeights.defaultWeights());
        CacheEntry a = Entries.raw("a", 10, clock);
        CacheEntry b = Entries.raw("b", 10, clock);
        int expected = Integer.signum(a.key().compareTo(b.key()));

        assertEquals(expected, Integer.signum(scorer.comparator(clock.instant()).compare(a, b)));
    }
}
