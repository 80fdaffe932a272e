package com.search.cache.migration;

import com.search.cache.tier.CacheEntry;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;

/**
 * Deterministic retention score for an entry; the lowest score is evicted first.
 *
 * <pre>
 * score = frequencyWeight * accessCount / ageSeconds
 *       + recencyWeight   / (1 + idleSeconds)
 * </pre>
 *
 * Age is floored at one second so a brand-new entry does not dominate.
 * Equal scores are ordered by key, unsigned lexicographically.
 */
public class EntryScorer {

    private static final double MIN_AGE_SECONDS = 1.0;

    private final ScoringWeights weights;

    public EntryScorer(ScoringWeights weights) {
        this.weights = weights;
    }

    public double score(CacheEntry entry, Instant now) {
        double ageSeconds = Math.max(MIN_AGE_SECONDS, seconds(Duration.between(entry.createdAt(), now)));
        double idleSeconds = Math.max(0.0, seconds(Duration.between(entry.lastAccessedAt(), now)));
        double frequency = entry.accessCount() / ageSeconds;
        double recency = 1.0 / (1.0 + idleSeconds);
        return weights.frequencyWeight() * frequency + weights.recencyWeight() * recency;
    }

    /**
     * Ascending retention priority at {@code now}: first element is the first to evict.
     */
    public Comparator<CacheEntry> comparator(Instant now) {
        return Comparator.<CacheEntry>comparingDouble(e -> score(e, now))
                .thenComparing(CacheEntry::key);
    }

    public ScoringWeights weights() {
        return weights;
    }

    private static double seconds(Duration d) {
        return d.toMillis() / 1000.0;
    }
}
