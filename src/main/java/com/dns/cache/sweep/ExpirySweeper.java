package com.dns.cache.sweep;

import com.dns.cache.engine.AddressCache;
import com.dns.cache.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic driver for {@link AddressCache#invalidateExpired()}.
 *
 * <p>The cache never schedules work on its own; this class owns a single daemon thread
 * that sweeps at a fixed rate once {@link #start()} is called. A failing sweep is logged
 * and the schedule continues.</p>
 */
public class ExpirySweeper implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExpirySweeper.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    private final AddressCache cache;
    private final String cacheName;
    private final Duration period;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong sweepCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    private final AtomicLong totalRemoved = new AtomicLong(0);

    public ExpirySweeper(AddressCache cache, Duration period) {
        this(cache, "dns-cache", period);
    }

    public ExpirySweeper(AddressCache cache, String cacheName, Duration period) {
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.cacheName = Objects.requireNonNull(cacheName, "cacheName is required");
        this.period = Objects.requireNonNull(period, "period is required");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0");
        }
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, cacheName + "-expiry-sweeper");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules sweeps at a fixed rate, the first one after one period.
     *
     * @throws IllegalStateException if already started or closed
     */
    public void start() {
        if (closed.get()) {
            throw new IllegalStateException("Sweeper is closed");
        }
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Sweeper already started");
        }
        long periodMs = period.toMillis();
        scheduler.scheduleAtFixedRate(this::runScheduledSweep, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("ExpirySweeper started: cache={}, period={}ms", cacheName, periodMs);
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return the number of entries removed
     */
    public int sweepNow() {
        try (LogContext ignored = LogContext.forSweep(cacheName)) {
            int removed = cache.invalidateExpired();
            sweepCount.incrementAndGet();
            totalRemoved.addAndGet(removed);
            if (removed > 0) {
                log.debug("sweep.completed removed={} size={}", removed, cache.size());
            }
            return removed;
        }
    }

    private void runScheduledSweep() {
        try {
            sweepNow();
        } catch (RuntimeException e) {
            failureCount.incrementAndGet();
            log.warn("sweep.failed cache={}: {}", cacheName, e.getMessage(), e);
        }
    }

    public boolean isRunning() {
        return started.get() && !closed.get();
    }

    public long getSweepCount() {
        return sweepCount.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public long getTotalRemoved() {
        return totalRemoved.get();
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                List<Runnable> pending = scheduler.shutdownNow();
                log.warn("ExpirySweeper did not stop within {}s, forced shutdown ({} pending tasks)",
                        SHUTDOWN_TIMEOUT_SECONDS, pending.size());
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("ExpirySweeper stopped: cache={}, sweeps={}, removed={}",
                cacheName, sweepCount.get(), totalRemoved.get());
    }
}
