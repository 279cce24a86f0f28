package com.dns.cache.engine;

import com.dns.cache.core.model.AddressRecord;
import com.dns.cache.core.model.CacheKey;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A cached record with its reference count and its linkage into the index and the recency list.
 *
 * <p>Payload fields are final. {@code prev}, {@code next} and {@code linked}
 * are guarded by the owning cache's lock. The reference count
 * is atomic and may change without the lock.</p>
 */
final class CacheEntry {

    static final int NIL = -1;

    private static final long NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

    final int slot;
    final long generation;
    final AddressRecord record;
    final CacheKey key;
    final long insertedAtNanos;
    final long ttlNanos;

    // The table itself holds one unit while the entry is linked
    private final AtomicInteger refCount = new AtomicInteger(1);

    int prev = NIL;
    int next = NIL;
    boolean linked;

    CacheEntry(int slot, long generation, AddressRecord record, long insertedAtNanos) {
        this.slot = slot;
        this.generation = generation;
        this.record = record;
        this.key = record.key();
        this.insertedAtNanos = insertedAtNanos;
        this.ttlNanos = TimeUnit.SECONDS.toNanos(record.getTtlSeconds());
    }

    /**
     * Stale once strictly more than the TTL has elapsed since insert.
     */
    boolean isExpired(long nowNanos) {
        return nowNanos - insertedAtNanos > ttlNanos;
    }

    /**
     * Whole seconds left, rounded up: at least 1 while fresh, 0 once stale.
     */
    long remainingSeconds(long nowNanos) {
        if (isExpired(nowNanos)) {
            return 0;
        }
        long remaining = ttlNanos - (nowNanos - insertedAtNanos);
        long seconds = (remaining + NANOS_PER_SECOND - 1) / NANOS_PER_SECOND;
        return Math.max(1, seconds);
    }

    boolean matches(CacheHandle handle) {
        return generation == handle.generation() && refCount.get() > 0;
    }

    void retain() {
        refCount.incrementAndGet();
    }

    /**
     * Drops one reference.
     *
     * @return true if this was the last reference and the entry must be freed
     * @throws StaleHandleException if no reference was left to drop
     */
    boolean release() {
        int before = refCount.getAndUpdate(c -> c > 0 ? c - 1 : c);
        if (before <= 0) {
            throw new StaleHandleException("Entry " + key + " (slot " + slot + ") was already released");
        }
        return before == 1;
    }

    int refCount() {
        return refCount.get();
    }

    CacheHandle handle() {
        return new CacheHandle(slot, generation, record);
    }
}
