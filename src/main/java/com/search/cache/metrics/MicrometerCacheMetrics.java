package com.search.cache.metrics;

import com.search.cache.tier.TierKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link CacheMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code search.cache.hit} (Counter, tag: tier)</li>
 *   <li>{@code search.cache.miss} (Counter)</li>
 *   <li>{@code search.cache.eviction} (Counter, tag: tier)</li>
 *   <li>{@code search.cache.promotion} (Counter, tags: from, to)</li>
 *   <li>{@code search.cache.demotion} (Counter, tags: from, to)</li>
 *   <li>{@code search.cache.corrupt} (Counter, tag: tier)</li>
 *   <li>{@code search.cache.expired} (Counter, tag: tier)</li>
 *   <li>{@code search.cache.fill.duration} (Timer)</li>
 *   <li>{@code search.cache.fill.failure} (Counter)</li>
 *   <li>{@code search.cache.fill.coalesced} (Counter)</li>
 * </ul>
 */
public class MicrometerCacheMetrics implements CacheMetrics {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter missCounter;
    private final Counter fillFailureCounter;
    private final Counter coalescedFillCounter;
    private final Timer fillTimer;

    public MicrometerCacheMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.missCounter = Counter.builder("search.cache.miss")
                .description("Lookups not answered by any tier")
                .register(registry);
        this.fillFailureCounter = Counter.builder("search.cache.fill.failure")
                .description("Fill functions that threw")
                .register(registry);
        this.coalescedFillCounter = Counter.builder("search.cache.fill.coalesced")
                .description("Misses answered by another caller's in-flight fill")
                .register(registry);
        this.fillTimer = Timer.builder("search.cache.fill.duration")
                .description("Duration of successful fill functions")
                .register(registry);
    }

    @Override
    public void recordHit(TierKind tier) {
        tierCounter("search.cache.hit", "Lookups answered by a tier", tier).increment();
    }

    @Override
    public void recordMiss() {
        missCounter.increment();
    }

    @Override
    public void recordEviction(TierKind tier, int count) {
        tierCounter("search.cache.eviction", "Entries evicted for capacity", tier).increment(count);
    }

    @Override
    public void recordPromotion(TierKind from, TierKind to) {
        movementCounter("search.cache.promotion", "Entries moved one tier up", from, to).increment();
    }

    @Override
    public void recordDemotion(TierKind from, TierKind to) {
        movementCounter("search.cache.demotion", "Entries moved one tier down", from, to).increment();
    }

    @Override
    public void recordCorruption(TierKind tier) {
        tierCounter("search.cache.corrupt", "Entries dropped because they failed to decode", tier).increment();
    }

    @Override
    public void recordExpirations(TierKind tier, long count) {
        tierCounter("search.cache.expired", "Entries dropped after their TTL", tier).increment(count);
    }

    @Override
    public void recordFill(Duration duration) {
        fillTimer.record(duration);
    }

    @Override
    public void recordFillFailure() {
        fillFailureCounter.increment();
    }

    @Override
    public void recordCoalescedFill() {
        coalescedFillCounter.increment();
    }

    private Counter tierCounter(String name, String description, TierKind tier) {
        String key = name + ":" + tier.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("tier", tier.tagValue())
                        .register(registry));
    }

    private Counter movementCounter(String name, String description, TierKind from, TierKind to) {
        String key = name + ":" + from.name() + ":" + to.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("from", from.tagValue())
                        .tag("to", to.tagValue())
                        .register(registry));
    }
}
