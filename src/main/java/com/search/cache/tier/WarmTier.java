package com.search.cache.tier;

import com.search.cache.key.CacheKey;
import com.search.cache.migration.EntryScorer;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Compressed in-process tier. Evicts by the lowest {@link EntryScorer} score,
 * so entries that keep being read survive longer than in the hot tier.
 */
public class WarmTier extends AbstractMemoryTier {

    private final EntryScorer scorer;

    public WarmTier(long budgetBytes, EntryScorer scorer, Clock clock) {
        this(budgetBytes, scorer, clock, TierListener.NONE);
    }

    public WarmTier(long budgetBytes, EntryScorer scorer, Clock clock, TierListener listener) {
        super(budgetBytes, clock, listener);
        this.scorer = scorer;
    }

    @Override
    public TierKind kind() {
        return TierKind.WARM;
    }

    @Override
    protected void checkFormat(CacheEntry entry) {
        if (!entry.payload().isCompressed()) {
            throw new IllegalArgumentException("Warm tier stores compressed payloads only");
        }
    }

    @Override
    protected void onInsert(CacheEntry entry) {
    }

    @Override
    protected void onRemove(CacheEntry entry) {
    }

    @Override
    protected void onAccess(CacheEntry entry) {
    }

    // O(n log n) in resident entries; scores change with time so no index is kept.
    // Scores are taken once up front because readers keep bumping counters during the sort.
    @Override
    protected List<CacheEntry> selectVictims(long bytesNeeded, CacheKey exclude, Instant now) {
        List<Scored> candidates = new ArrayList<>(entries.size());
        for (CacheEntry entry : entries.values()) {
            if (!entry.key().equals(exclude)) {
                candidates.add(new Scored(entry, scorer.score(entry, now)));
            }
        }
        candidates.sort(Comparator.comparingDouble(Scored::score)
                .thenComparing(s -> s.entry().key()));
        List<CacheEntry> victims = new ArrayList<>();
        long freed = 0;
        for (Scored candidate : candidates) {
            if (freed >= bytesNeeded) {
                break;
            }
            victims.add(candidate.entry());
            freed += candidate.entry().sizeBytes();
        }
        return victims;
    }

    @Override
    public Comparator<CacheEntry> evictionOrder(Instant now) {
        return scorer.comparator(now);
    }

    private record Scored(CacheEntry entry, double score) {
    }
}
