package com.search.cache.tier;

import com.search.cache.codec.CodecRegistry;
import com.search.cache.codec.CorruptEntryException;
import com.search.cache.codec.EncodedPayload;
import com.search.cache.key.CacheKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The three tiers behind one set of per-key stripe locks.
 *
 * <p>Owns single residency: every operation that puts a key into a tier runs
 * under that key's exclusive stripe and first removes the key from the other
 * tiers, so a key is never observed in two tiers. Payload format conversion
 * between raw (hot) and compressed (warm, cold) happens here too.</p>
 */
public class TieredStore {
    private static final Logger log = LoggerFactory.getLogger(TieredStore.class);

    /**
     * Per-tier probe outcome, reported in probe order.
     */
    @FunctionalInterface
    public interface ProbeListener {
        ProbeListener NONE = (tier, hit, nanos) -> {
        };

        void probed(TierKind tier, boolean hit, long nanos);
    }

    /**
     * A lookup hit and the tier that served it.
     */
    public record Hit(CacheEntry entry, TierKind tier) {
    }

    private final Map<TierKind, Tier> tiers = new EnumMap<>(TierKind.class);
    private final ColdTier cold;
    private final CodecRegistry codecs;
    private final KeyStripes stripes;
    private final TierListener listener;

    public TieredStore(HotTier hot, WarmTier warm, ColdTier cold, CodecRegistry codecs,
                       KeyStripes stripes, TierListener listener) {
        tiers.put(TierKind.HOT, hot);
        tiers.put(TierKind.WARM, warm);
        tiers.put(TierKind.COLD, cold);
        this.cold = cold;
        this.codecs = codecs;
        this.stripes = stripes;
        this.listener = listener != null ? listener : TierListener.NONE;
        cold.setMemoryResidency(key -> hot.contains(key) || warm.contains(key));
    }

    public Tier tier(TierKind kind) {
        return tiers.get(kind);
    }

    public ColdTier coldTier() {
        return cold;
    }

    public CodecRegistry codecs() {
        return codecs;
    }

    /**
     * Probes hot, warm and cold in order and returns the first live entry.
     */
    public Optional<Hit> lookup(CacheKey key, ProbeListener probes) {
        return stripes.read(key, () -> {
            for (Tier tier : tiers.values()) {
                long start = System.nanoTime();
                Optional<CacheEntry> found = tier.get(key);
                probes.probed(tier.kind(), found.isPresent(), System.nanoTime() - start);
                if (found.isPresent()) {
                    return Optional.of(new Hit(found.get(), tier.kind()));
                }
            }
            return Optional.empty();
        });
    }

    /**
     * Tier currently holding the key, without touching access counters.
     */
    public Optional<TierKind> residency(CacheKey key) {
        return stripes.read(key, () -> residencyLocked(key));
    }

    /**
     * Whether any tier holds an unexpired entry for the key.
     */
    public boolean isLive(CacheKey key, Instant now) {
        return stripes.read(key, () -> {
            for (Tier tier : tiers.values()) {
                if (tier.isLive(key, now)) {
                    return true;
                }
            }
            return false;
        });
    }

    private Optional<TierKind> residencyLocked(CacheKey key) {
        for (Tier tier : tiers.values()) {
            if (tier.contains(key)) {
                return Optional.of(tier.kind());
            }
        }
        return Optional.empty();
    }

    /**
     * Writes a freshly filled entry into the hot tier, replacing whatever any
     * tier held for the key.
     */
    public EvictionReport place(CacheEntry entry) {
        if (entry.payload().isCompressed()) {
            throw new IllegalArgumentException("Fills are placed raw");
        }
        return stripes.write(entry.key(), () -> {
            for (Tier tier : tiers.values()) {
                if (tier.kind() != TierKind.HOT) {
                    tier.remove(entry.key());
                }
            }
            return tiers.get(TierKind.HOT).put(entry);
        });
    }

    /**
     * Moves a resident key one tier up. If the destination refuses it, the entry
     * goes back where it was.
     */
    public Migration promote(CacheKey key, TierKind from) {
        TierKind to = from.higher().orElseThrow(
                () -> new IllegalArgumentException(from + " has no higher tier"));
        return stripes.write(key, () -> {
            Tier source = tiers.get(from);
            if (!source.contains(key)) {
                return Migration.skipped(from, to);
            }
            Optional<CacheEntry> removed = source.remove(key);
            if (removed.isEmpty()) {
                return Migration.skipped(from, to);
            }
            Optional<CacheEntry> converted = convert(removed.get(), to);
            if (converted.isEmpty()) {
                return Migration.skipped(from, to);
            }
            EvictionReport report = tiers.get(to).put(converted.get());
            if (report.rejected()) {
                source.put(removed.get());
                return Migration.skipped(from, to);
            }
            return new Migration(from, to, true, report);
        });
    }

    /**
     * Offers an entry that was just evicted from {@code from} to the next tier
     * down. Dropped if the key became resident again in the meantime or the
     * destination would have to displace entries of equal or higher priority.
     */
    public Migration demoteEvicted(CacheEntry evicted, TierKind from) {
        Optional<TierKind> lower = from.lower();
        if (lower.isEmpty()) {
            return Migration.skipped(from, from);
        }
        TierKind to = lower.get();
        return stripes.write(evicted.key(), () -> {
            if (residencyLocked(evicted.key()).isPresent()) {
                return Migration.skipped(from, to);
            }
            Optional<CacheEntry> converted = convert(evicted, to);
            if (converted.isEmpty()) {
                return Migration.skipped(from, to);
            }
            EvictionReport report = tiers.get(to).offer(converted.get());
            return new Migration(from, to, report.admitted(), report);
        });
    }

    /**
     * Moves a resident key one tier down, used for idle entries. The entry stays
     * where it is when the destination will not take it.
     */
    public Migration demoteResident(CacheKey key, TierKind from) {
        Optional<TierKind> lower = from.lower();
        if (lower.isEmpty()) {
            return Migration.skipped(from, from);
        }
        TierKind to = lower.get();
        return stripes.write(key, () -> {
            Tier source = tiers.get(from);
            Optional<CacheEntry> removed = source.remove(key);
            if (removed.isEmpty()) {
                return Migration.skipped(from, to);
            }
            Optional<CacheEntry> converted = convert(removed.get(), to);
            if (converted.isEmpty()) {
                return Migration.skipped(from, to);
            }
            EvictionReport report = tiers.get(to).offer(converted.get());
            if (report.rejected()) {
                source.put(removed.get());
                return Migration.skipped(from, to);
            }
            return new Migration(from, to, true, report);
        });
    }

    /**
     * Removes the key from whichever tier holds it. A cold record that cannot
     * be deleted right now, because cold storage is down, is deleted once the
     * cold tier recovers.
     *
     * @return whether anything was removed
     */
    public boolean remove(CacheKey key) {
        return stripes.write(key, () -> {
            boolean removed = false;
            for (Tier tier : tiers.values()) {
                if (tier == cold) {
                    removed |= cold.discard(key);
                } else if (tier.contains(key)) {
                    tier.remove(key);
                    removed = true;
                }
            }
            return removed;
        });
    }

    /**
     * Drops an entry whose payload failed to decode.
     */
    public void discardCorrupt(CacheKey key, TierKind tier) {
        stripes.write(key, () -> tiers.get(tier).remove(key));
        listener.onCorrupt(tier, key);
    }

    /**
     * Empties every tier.
     *
     * @return entries removed per tier
     */
    public Map<TierKind, Integer> clear() {
        Map<TierKind, Integer> removed = new EnumMap<>(TierKind.class);
        for (Tier tier : tiers.values()) {
            removed.put(tier.kind(), tier.clear());
        }
        return removed;
    }

    public List<Tier> tiers() {
        return List.copyOf(tiers.values());
    }

    private Optional<CacheEntry> convert(CacheEntry entry, TierKind to) {
        try {
            EncodedPayload payload = to == TierKind.HOT
                    ? codecs.toRaw(entry.payload())
                    : codecs.toCompressed(entry.payload());
            if (payload.isCompressed() && !entry.payload().isCompressed()) {
                listener.onCompressed(payload.rawLength(), payload.sizeBytes());
            }
            return Optional.of(payload == entry.payload() ? entry : entry.withPayload(payload));
        } catch (CorruptEntryException e) {
            log.warn("tier.convert.corrupt key={} to={} reason={}", entry.key().shortHex(), to, e.getMessage());
            listener.onCorrupt(entry.tier(), entry.key());
            return Optional.empty();
        }
    }
}
