package com.dns.cache.health;

import com.dns.cache.engine.AddressCache;
import com.dns.cache.engine.CacheStats;

/**
 * Health check for an address cache.
 * DOWN once the cache is closed; DEGRADED when entries held by callers after leaving the
 * cache approach the detached-entry limit, since inserts start failing when it is reached.
 */
public class AddressCacheHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final AddressCache cache;
    private final int maxDetachedEntries;

    public AddressCacheHealthCheck(AddressCache cache, int maxDetachedEntries) {
        this.cache = cache;
        this.maxDetachedEntries = maxDetachedEntries;
    }

    @Override
    public String getName() {
        return "addressCache";
    }

    @Override
    public HealthStatus check() {
        if (cache.isClosed()) {
            return HealthStatus.down("Address cache is closed");
        }

        CacheStats stats = cache.getStats();
        if (stats.capacity() <= 0) {
            return HealthStatus.up("Address cache disabled")
                    .withDetail("capacity", stats.capacity());
        }

        double detachedRatio = maxDetachedEntries > 0 ? (double) stats.detachedEntries() / maxDetachedEntries : 0.0;

        HealthStatus base;
        if (detachedRatio >= DEGRADED_THRESHOLD) {
            base = HealthStatus.degraded("Unreleased handles near limit: " +
                    stats.detachedEntries() + "/" + maxDetachedEntries);
        } else {
            base = HealthStatus.up();
        }

        return base
                .withDetail("size", stats.size())
                .withDetail("capacity", stats.capacity())
                .withDetail("detachedEntries", stats.detachedEntries())
                .withDetail("hitRate", Math.round(stats.hitRate() * 1000.0) / 10.0)
                .withDetail("evictions", stats.evictionCount())
                .withDetail("expirations", stats.expirationCount());
    }
}
