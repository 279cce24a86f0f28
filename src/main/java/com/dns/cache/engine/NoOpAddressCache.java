package com.dns.cache.engine;

import com.dns.cache.core.model.RecordType;

import java.util.Optional;

/**
 * Disabled cache. Inserts succeed without storing anything and every lookup misses.
 * Used when the configured capacity is zero or negative.
 */
public class NoOpAddressCache implements AddressCache {

    private final int capacity;

    public NoOpAddressCache() {
        this(CacheConfig.disabled());
    }

    public NoOpAddressCache(CacheConfig config) {
        this.capacity = config.capacity();
    }

    @Override
    public InsertOutcome insert(String domain, int ttlSeconds, RecordType recordType, byte[] address) {
        return InsertOutcome.DISABLED;
    }

    @Override
    public Optional<CacheHandle> get(String domain, RecordType recordType) {
        return Optional.empty();
    }

    @Override
    public void release(CacheHandle handle) {
        // no-op
    }

    @Override
    public void update(CacheHandle handle) {
        // no-op
    }

    @Override
    public void delete(CacheHandle handle) {
        // no-op
    }

    @Override
    public long remainingTtl(CacheHandle handle) {
        return 0;
    }

    @Override
    public int invalidateExpired() {
        return 0;
    }

    @Override
    public int invalidateAll() {
        return 0;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public CacheStats getStats() {
        return new CacheStats(0, 0, 0, 0, 0, 0, capacity, 0);
    }

    @Override
    public boolean isClosed() {
        return false;
    }

    @Override
    public void close() {
        // no-op
    }
}
