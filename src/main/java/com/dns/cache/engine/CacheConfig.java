package com.dns.cache.engine;

import java.util.Objects;

/**
 * Configuration for an address cache.
 *
 * @param capacity           maximum number of live entries; {@code <= 0} disables the cache
 * @param maxDetachedEntries how many entries may stay alive after being evicted, expired or deleted
 *                           while callers still hold handles to them
 * @param sweepMode          how {@link AddressCache#invalidateExpired()} walks the recency list
 */
public record CacheConfig(int capacity, int maxDetachedEntries, SweepMode sweepMode) {

    public CacheConfig {
        if (maxDetachedEntries < 1) {
            throw new IllegalArgumentException("maxDetachedEntries must be >= 1");
        }
        Objects.requireNonNull(sweepMode, "sweepMode is required");
    }

    /**
     * Default configuration: 10,000 entries, 10,000 detached entries, full-scan sweeps.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 10_000, SweepMode.FULL_SCAN);
    }

    /**
     * Disabled cache configuration.
     */
    public static CacheConfig disabled() {
        return new CacheConfig(0, 1, SweepMode.FULL_SCAN);
    }

    /**
     * Configuration with the given capacity and default settings otherwise.
     */
    public static CacheConfig ofCapacity(int capacity) {
        return new CacheConfig(capacity, Math.max(1, capacity), SweepMode.FULL_SCAN);
    }

    public boolean isEnabled() {
        return capacity > 0;
    }

    /**
     * Returns the number of entry slots the cache may allocate: linked entries plus detached ones.
     */
    public int slotLimit() {
        return (int) Math.min(Integer.MAX_VALUE - 8L, (long) capacity + maxDetachedEntries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int capacity = 10_000;
        private Integer maxDetachedEntries;
        private SweepMode sweepMode = SweepMode.FULL_SCAN;

        public Builder capacity(int capacity) {
            this.capacity = capacity;
            return this;
        }

        public Builder maxDetachedEntries(int maxDetachedEntries) {
            this.maxDetachedEntries = maxDetachedEntries;
            return this;
        }

        public Builder sweepMode(SweepMode sweepMode) {
            this.sweepMode = sweepMode;
            return this;
        }

        public CacheConfig build() {
            int detached = maxDetachedEntries != null ? maxDetachedEntries : Math.max(1, capacity);
            return new CacheConfig(capacity, detached, sweepMode);
        }
    }
}
