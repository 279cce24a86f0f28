package com.dns.cache.metrics;

import com.dns.cache.core.model.RecordType;

import java.time.Duration;

/**
 * Interface for recording address cache metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the cache works
 * without any metrics backend configured.
 */
public interface MetricsService {

    /**
     * What caused an expired entry to be dropped.
     */
    enum ExpiryTrigger { READ, INSERT, SWEEP }

    void recordCacheHit(RecordType type);

    void recordCacheMiss(RecordType type);

    void recordInsert(RecordType type);

    void recordEviction();

    void recordExpiration(ExpiryTrigger trigger, int count);

    void recordSweep(int removed, Duration duration);
}
