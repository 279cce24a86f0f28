package com.dns.cache.engine;

import com.dns.cache.core.InvalidRecordException;
import com.dns.cache.core.model.RecordType;
import com.dns.cache.metrics.MetricsService;
import com.dns.cache.metrics.NoOpMetricsService;

import java.util.Optional;

/**
 * Bounded, thread-safe, TTL-aware cache of A and AAAA records keyed by domain and record type.
 *
 * <p>Lookups hand out reference-counted {@link CacheHandle}s. Every handle returned by
 * {@link #get} must be given back with exactly one {@link #release} call; the entry
 * stays readable through the handle even if the cache evicts, expires or deletes it
 * in the meantime.</p>
 *
 * <p>The cache does not schedule anything itself. Expired entries are dropped lazily
 * on read and by {@link #invalidateExpired()}, which a driver such as
 * {@link com.dns.cache.sweep.ExpirySweeper} calls periodically.</p>
 */
public interface AddressCache extends AutoCloseable {

    /**
     * Creates a cache for the given configuration: a {@link NoOpAddressCache} when the
     * configured capacity is zero or negative, a {@link TtlAddressCache} otherwise.
     */
    static AddressCache create(CacheConfig config) {
        return create(config, new NoOpMetricsService());
    }

    static AddressCache create(CacheConfig config, MetricsService metrics) {
        if (!config.isEnabled()) {
            return new NoOpAddressCache(config);
        }
        return new TtlAddressCache(config, metrics);
    }

    /**
     * Caches an address record. The first insert for a domain and type wins: while a
     * fresh entry exists, later inserts for the same key leave it untouched.
     *
     * @param domain     the domain name
     * @param ttlSeconds time-to-live in seconds
     * @param recordType A or AAAA
     * @param address    4 bytes for A, 16 bytes for AAAA
     * @return what happened to the record
     * @throws InvalidRecordException    if the record fails validation
     * @throws CacheAllocationException  if no entry slot is available
     */
    InsertOutcome insert(String domain, int ttlSeconds, RecordType recordType, byte[] address);

    /**
     * Looks up a fresh entry. An expired entry found on the way is dropped and
     * reported as a miss.
     *
     * @return a handle the caller must release, or empty on a miss
     * @throws InvalidRecordException if the domain is null, empty or too long, or the type is null
     */
    Optional<CacheHandle> get(String domain, RecordType recordType);

    /**
     * Gives back the reference held by a handle.
     *
     * @throws StaleHandleException if the handle was already released
     */
    void release(CacheHandle handle);

    /**
     * Moves the entry to the most-recently-touched end of the eviction order.
     * No-op if the entry is no longer in the cache.
     */
    void update(CacheHandle handle);

    /**
     * Removes the entry from the cache regardless of its TTL. The handle itself stays
     * valid and must still be released.
     */
    void delete(CacheHandle handle);

    /**
     * Returns the whole seconds left before the entry expires, never negative.
     */
    long remainingTtl(CacheHandle handle);

    /**
     * Drops expired entries.
     *
     * @return the number of entries removed
     */
    int invalidateExpired();

    /**
     * Drops every entry. Handles held by callers stay valid until released.
     *
     * @return the number of entries removed
     */
    int invalidateAll();

    int size();

    int capacity();

    CacheStats getStats();

    boolean isClosed();

    /**
     * Tears the cache down, dropping every entry regardless of outstanding handles.
     * Must not run concurrently with other operations.
     */
    @Override
    void close();
}
