package com.dns.cache.engine;

import com.dns.cache.core.InvalidRecordException;
import com.dns.cache.core.model.AddressRecord;
import com.dns.cache.core.model.CacheKey;
import com.dns.cache.core.model.RecordType;
import com.dns.cache.metrics.MetricsService;
import com.dns.cache.metrics.MetricsService.ExpiryTrigger;
import com.dns.cache.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Address cache built from a hash index and a recency list over the same entries.
 *
 * <p>One {@link ReentrantLock} guards every structural change: linking, unlinking,
 * repositioning and slot allocation. Reference counts are atomic and live outside the
 * lock, so {@link #release(CacheHandle)} and {@link #remainingTtl(CacheHandle)} never
 * block on inserts or sweeps running in other threads.</p>
 *
 * <p>An entry is in the index if and only if it is in the recency list. While linked,
 * the cache itself holds one reference; every unlink path (eviction, expiry, delete)
 * gives that reference back, and the slot is freed when the last caller releases.</p>
 *
 * <p>Reads do not reorder entries. Eviction order is insertion order unless a caller
 * signals freshness with {@link #update(CacheHandle)}.</p>
 */
public class TtlAddressCache implements AddressCache {
    private static final Logger log = LoggerFactory.getLogger(TtlAddressCache.class);

    private final CacheConfig config;
    private final MetricsService metrics;
    private final Ticker ticker;

    private final ReentrantLock lock = new ReentrantLock();
    private final EntryArena arena;
    private final HashIndex index;
    private final RecencyList recency;
    private int count;
    private volatile boolean closed;

    private final AtomicLong hitCount = new AtomicLong(0);
    private final AtomicLong missCount = new AtomicLong(0);
    private final AtomicLong insertCount = new AtomicLong(0);
    private final AtomicLong evictionCount = new AtomicLong(0);
    private final AtomicLong expirationCount = new AtomicLong(0);

    public TtlAddressCache(CacheConfig config) {
        this(config, new NoOpMetricsService(), Ticker.systemTicker());
    }

    public TtlAddressCache(CacheConfig config, MetricsService metrics) {
        this(config, metrics, Ticker.systemTicker());
    }

    public TtlAddressCache(CacheConfig config, MetricsService metrics, Ticker ticker) {
        this.config = Objects.requireNonNull(config, "config is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.ticker = Objects.requireNonNull(ticker, "ticker is required");
        if (!config.isEnabled()) {
            throw new IllegalArgumentException(
                    "capacity must be > 0 (was " + config.capacity() + "); use AddressCache.create for a disabled cache");
        }
        this.arena = new EntryArena(config.slotLimit());
        this.index = new HashIndex(arena, config.capacity());
        this.recency = new RecencyList(arena);
        log.info("TtlAddressCache initialized: capacity={}, maxDetachedEntries={}, sweepMode={}",
                config.capacity(), config.maxDetachedEntries(), config.sweepMode());
    }

    @Override
    public InsertOutcome insert(String domain, int ttlSeconds, RecordType recordType, byte[] address) {
        AddressRecord record = AddressRecord.of(domain, recordType, address, ttlSeconds);
        CacheKey key = record.key();
        boolean expiredExisting = false;
        boolean evicted = false;

        lock.lock();
        try {
            ensureOpen();
            long now = ticker.read();
            CacheEntry existing = index.find(key);
            if (existing != null) {
                if (!existing.isExpired(now)) {
                    log.debug("cache.insert.duplicate key={}", key);
                    return InsertOutcome.ALREADY_PRESENT;
                }
                unlink(existing);
                expiredExisting = true;
            }

            CacheEntry entry = arena.allocate(record, now);
            index.add(entry);
            recency.append(entry);
            count++;

            if (count > config.capacity()) {
                CacheEntry oldest = recency.first();
                log.debug("cache.evicted key={} count={} capacity={}", oldest.key, count, config.capacity());
                unlink(oldest);
                evicted = true;
            }
        } finally {
            lock.unlock();
        }

        insertCount.incrementAndGet();
        metrics.recordInsert(recordType);
        if (expiredExisting) {
            expirationCount.incrementAndGet();
            metrics.recordExpiration(ExpiryTrigger.INSERT, 1);
        }
        if (evicted) {
            evictionCount.incrementAndGet();
            metrics.recordEviction();
        }
        return InsertOutcome.INSERTED;
    }

    @Override
    public Optional<CacheHandle> get(String domain, RecordType recordType) {
        AddressRecord.validateDomain(domain);
        if (recordType == null) {
            throw new InvalidRecordException("Record type must not be null");
        }
        CacheKey key = new CacheKey(domain, recordType);
        CacheHandle handle = null;
        boolean expired = false;

        lock.lock();
        try {
            ensureOpen();
            CacheEntry entry = index.find(key);
            if (entry != null) {
                if (entry.isExpired(ticker.read())) {
                    log.debug("cache.expired.onRead key={}", key);
                    unlink(entry);
                    expired = true;
                } else {
                    // still linked: the table's unit keeps the count above zero
                    entry.retain();
                    handle = entry.handle();
                }
            }
        } finally {
            lock.unlock();
        }

        if (handle != null) {
            hitCount.incrementAndGet();
            metrics.recordCacheHit(recordType);
        } else {
            missCount.incrementAndGet();
            metrics.recordCacheMiss(recordType);
            if (expired) {
                expirationCount.incrementAndGet();
                metrics.recordExpiration(ExpiryTrigger.READ, 1);
            }
        }
        return Optional.ofNullable(handle);
    }

    @Override
    public void release(CacheHandle handle) {
        Objects.requireNonNull(handle, "handle is required");
        if (closed) {
            log.debug("cache.release.afterClose key={}", handle.record().key());
            return;
        }
        releaseReference(arena.resolve(handle));
    }

    @Override
    public void update(CacheHandle handle) {
        Objects.requireNonNull(handle, "handle is required");
        lock.lock();
        try {
            ensureOpen();
            CacheEntry entry = arena.resolve(handle);
            if (entry.linked) {
                recency.moveToTail(entry);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(CacheHandle handle) {
        Objects.requireNonNull(handle, "handle is required");
        lock.lock();
        try {
            ensureOpen();
            CacheEntry entry = arena.resolve(handle);
            if (entry.linked) {
                log.debug("cache.deleted key={}", entry.key);
                unlink(entry);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long remainingTtl(CacheHandle handle) {
        Objects.requireNonNull(handle, "handle is required");
        ensureOpen();
        return arena.resolve(handle).remainingSeconds(ticker.read());
    }

    @Override
    public int invalidateExpired() {
        long startNanos = ticker.read();
        int removed = 0;

        lock.lock();
        try {
            ensureOpen();
            long now = ticker.read();
            CacheEntry entry = recency.first();
            while (entry != null) {
                CacheEntry next = recency.next(entry);
                if (entry.isExpired(now)) {
                    unlink(entry);
                    removed++;
                } else if (config.sweepMode() == SweepMode.STOP_AT_FIRST_FRESH) {
                    break;
                }
                entry = next;
            }
        } finally {
            lock.unlock();
        }

        Duration elapsed = Duration.ofNanos(Math.max(0, ticker.read() - startNanos));
        expirationCount.addAndGet(removed);
        metrics.recordExpiration(ExpiryTrigger.SWEEP, removed);
        metrics.recordSweep(removed, elapsed);
        log.debug("cache.sweep.completed removed={} remaining={} durationMs={}",
                removed, size(), elapsed.toMillis());
        return removed;
    }

    @Override
    public int invalidateAll() {
        int removed = 0;
        lock.lock();
        try {
            ensureOpen();
            CacheEntry entry = recency.first();
            while (entry != null) {
                CacheEntry next = recency.next(entry);
                unlink(entry);
                removed++;
                entry = next;
            }
        } finally {
            lock.unlock();
        }
        log.debug("cache.invalidatedAll removed={}", removed);
        return removed;
    }

    @Override
    public int size() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int capacity() {
        return config.capacity();
    }

    @Override
    public CacheStats getStats() {
        int size;
        int detached;
        lock.lock();
        try {
            size = count;
            detached = closed ? 0 : Math.max(0, arena.allocatedCount() - count);
        } finally {
            lock.unlock();
        }
        return new CacheStats(
                hitCount.get(),
                missCount.get(),
                insertCount.get(),
                evictionCount.get(),
                expirationCount.get(),
                size,
                config.capacity(),
                detached
        );
    }

    /**
     * Returns the number of entry slots this cache may hold, live plus detached.
     */
    public int slotLimit() {
        return arena.slotLimit();
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            int dropped = count;
            index.clear();
            recency.clear();
            arena.reset();
            count = 0;
            closed = true;
            log.info("TtlAddressCache closed: dropped {} entries", dropped);
        } finally {
            lock.unlock();
        }
    }

    // ── internal ──────────────────────────────────────────────

    /**
     * Removes an entry from both structures and gives back the table's own reference.
     * Caller holds the lock.
     */
    private void unlink(CacheEntry entry) {
        index.remove(entry);
        recency.remove(entry);
        count--;
        releaseReference(entry);
    }

    private void releaseReference(CacheEntry entry) {
        if (entry.release()) {
            arena.free(entry);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Cache is closed");
        }
    }
}
