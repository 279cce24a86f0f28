package com.dns.cache.engine;

import com.dns.cache.core.model.RecordType;
import com.dns.cache.metrics.NoOpMetricsService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TtlAddressCache Concurrency Tests")
class TtlAddressCacheConcurrencyTest {

    private static final int THREADS = 8;

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(THREADS);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Concurrent inserts of one key store exactly one record")
    void sameKeyInsertRace() throws Exception {
        TtlAddressCache cache = new TtlAddressCache(CacheConfig.ofCapacity(16));
        CountDownLatch startLatch = new CountDownLatch(1);
        List<Future<InsertOutcome>> futures = new ArrayList<>();

        for (int i = 0; i < THREADS; i++) {
            byte octet = (byte) i;
            futures.add(executor.submit(() -> {
                startLatch.await();
                return cache.insert("race.com", 60, RecordType.A, new byte[]{10, 0, 0, octet});
            }));
        }
        startLatch.countDown();

        int inserted = 0;
        for (Future<InsertOutcome> future : futures) {
            if (future.get(10, TimeUnit.SECONDS) == InsertOutcome.INSERTED) {
                inserted++;
            }
        }

        assertEquals(1, inserted, "Exactly one insert should win");
        assertEquals(1, cache.size());
    }

    @Test
    @DisplayName("Mixed operations keep the cache bounded and balanced")
    void mixedOperations() throws Exception {
        int capacity = 32;
        TtlAddressCache cache = new TtlAddressCache(
                CacheConfig.builder().capacity(capacity).maxDetachedEntries(1024).build());
        int opsPerThread = 2_000;
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger hits = new AtomicInteger(0);
        List<Future<Void>> futures = new ArrayList<>();

        for (int t = 0; t < THREADS; t++) {
            Callable<Void> worker = () -> {
                startLatch.await();
                ThreadLocalRandom random = ThreadLocalRandom.current();
                for (int i = 0; i < opsPerThread; i++) {
                    String domain = "host" + random.nextInt(64) + ".com";
                    cache.insert(domain, random.nextInt(3), RecordType.A, new byte[]{10, 0, 0, 1});

                    Optional<CacheHandle> handle = cache.get(domain, RecordType.A);
                    if (handle.isPresent()) {
                        hits.incrementAndGet();
                        CacheHandle h = handle.get();
                        assertEquals(domain, h.record().getDomain());
                        switch (random.nextInt(4)) {
                            case 0 -> cache.update(h);
                            case 1 -> cache.delete(h);
                            case 2 -> cache.remainingTtl(h);
                            default -> { }
                        }
                        cache.release(h);
                    }
                    if (i % 500 == 0) {
                        cache.invalidateExpired();
                    }
                    assertTrue(cache.size() <= capacity);
                }
                return null;
            };
            futures.add(executor.submit(worker));
        }
        startLatch.countDown();

        for (Future<Void> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }

        CacheStats stats = cache.getStats();
        assertTrue(stats.size() <= capacity);
        assertEquals(0, stats.detachedEntries(), "Every handle was released");
        assertEquals(hits.get(), stats.hitCount());
        assertEquals(THREADS * opsPerThread, stats.hitCount() + stats.missCount());
    }

    @Test
    @DisplayName("Release while another thread evicts frees the entry exactly once")
    void releaseRacesEviction() throws Exception {
        TtlAddressCache cache = new TtlAddressCache(
                CacheConfig.builder().capacity(1).maxDetachedEntries(THREADS * 2).build());

        for (int round = 0; round < 200; round++) {
            String domain = "round" + round + ".com";
            cache.insert(domain, 60, RecordType.A, new byte[]{1, 1, 1, 1});
            List<CacheHandle> handles = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                handles.add(cache.get(domain, RecordType.A).orElseThrow());
            }

            CountDownLatch startLatch = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (CacheHandle handle : handles) {
                futures.add(executor.submit(() -> {
                    startLatch.await();
                    cache.release(handle);
                    return null;
                }));
            }
            futures.add(executor.submit(() -> {
                startLatch.await();
                cache.insert("next" + domain, 60, RecordType.A, new byte[]{2, 2, 2, 2});
                return null;
            }));
            startLatch.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }

            assertEquals(1, cache.size());
            assertEquals(0, cache.getStats().detachedEntries());
            cache.invalidateAll();
        }
    }
}
