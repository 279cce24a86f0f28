package com.dns.cache.engine;

/**
 * Cache counters and occupancy.
 *
 * @param hitCount        lookups that returned a handle
 * @param missCount       lookups that found nothing or only an expired entry
 * @param insertCount     inserts that linked a new entry
 * @param evictionCount   entries dropped to keep the cache within capacity
 * @param expirationCount entries dropped because their TTL elapsed (on read, on insert or by sweep)
 * @param size            current number of live entries
 * @param capacity        maximum number of live entries
 * @param detachedEntries entries no longer in the cache but still held by callers
 */
public record CacheStats(long hitCount, long missCount, long insertCount, long evictionCount,
                         long expirationCount, int size, int capacity, int detachedEntries) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
