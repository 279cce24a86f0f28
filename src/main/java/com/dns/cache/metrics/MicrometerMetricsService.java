package com.dns.cache.metrics;

import com.dns.cache.core.model.RecordType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code dns.cache.hit}: Counter (tag: recordType)</li>
 *   <li>{@code dns.cache.miss}: Counter (tag: recordType)</li>
 *   <li>{@code dns.cache.insert}: Counter (tag: recordType)</li>
 *   <li>{@code dns.cache.eviction}: Counter</li>
 *   <li>{@code dns.cache.expiration}: Counter (tag: trigger)</li>
 *   <li>{@code dns.cache.sweep.duration}: Timer</li>
 *   <li>{@code dns.cache.sweep.removed}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter evictionCounter;
    private final Timer sweepTimer;
    private final DistributionSummary sweepRemovedSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.evictionCounter = Counter.builder("dns.cache.eviction")
                .description("Entries evicted to stay within capacity")
                .register(registry);
        this.sweepTimer = Timer.builder("dns.cache.sweep.duration")
                .description("Duration of expiry sweeps")
                .register(registry);
        this.sweepRemovedSummary = DistributionSummary.builder("dns.cache.sweep.removed")
                .description("Entries removed per expiry sweep")
                .register(registry);
    }

    @Override
    public void recordCacheHit(RecordType type) {
        typedCounter("dns.cache.hit", "Number of address cache hits", type).increment();
    }

    @Override
    public void recordCacheMiss(RecordType type) {
        typedCounter("dns.cache.miss", "Number of address cache misses", type).increment();
    }

    @Override
    public void recordInsert(RecordType type) {
        typedCounter("dns.cache.insert", "Number of entries inserted", type).increment();
    }

    @Override
    public void recordEviction() {
        evictionCounter.increment();
    }

    @Override
    public void recordExpiration(ExpiryTrigger trigger, int count) {
        if (count <= 0) {
            return;
        }
        String key = "expiration:" + trigger.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("dns.cache.expiration")
                        .description("Entries dropped because their TTL elapsed")
                        .tag("trigger", trigger.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordSweep(int removed, Duration duration) {
        sweepTimer.record(duration);
        sweepRemovedSummary.record(removed);
    }

    private Counter typedCounter(String name, String description, RecordType type) {
        String key = name + ":" + type.name();
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("recordType", type.name())
                        .register(registry));
    }
}
