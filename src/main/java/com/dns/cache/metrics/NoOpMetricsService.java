package com.dns.cache.metrics;

import com.dns.cache.core.model.RecordType;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit(RecordType type) {
    }

    @Override
    public void recordCacheMiss(RecordType type) {
    }

    @Override
    public void recordInsert(RecordType type) {
    }

    @Override
    public void recordEviction() {
    }

    @Override
    public void recordExpiration(ExpiryTrigger trigger, int count) {
    }

    @Override
    public void recordSweep(int removed, Duration duration) {
    }
}
