package com.dns.cache.cdi;

import com.dns.cache.engine.AddressCache;
import com.dns.cache.engine.CacheConfig;
import com.dns.cache.engine.SweepMode;
import com.dns.cache.health.AddressCacheHealthCheck;
import com.dns.cache.health.HealthCheckRegistry;
import com.dns.cache.logging.LogContext;
import com.dns.cache.metrics.MetricsService;
import com.dns.cache.metrics.MicrometerMetricsService;
import com.dns.cache.metrics.NoOpMetricsService;
import com.dns.cache.sweep.ExpirySweeper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Locale;

/**
 * CDI producer that wires the address cache from MicroProfile Config properties.
 *
 * <h2>Configuration</h2>
 * <pre>
 * dns-cache:
 *   name: resolver-cache
 *   capacity: 10000              # 0 or less disables the cache
 *   max-detached-entries: 10000
 *   sweep-mode: full-scan        # or stop-at-first-fresh
 *   sweep-period-seconds: 5      # 0 disables the background sweeper
 * </pre>
 *
 * <p>When a Micrometer {@link MeterRegistry} bean is available, cache metrics are
 * published to it; otherwise metrics are dropped.</p>
 */
@ApplicationScoped
public class DnsCacheProducer {

    private static final Logger log = LoggerFactory.getLogger(DnsCacheProducer.class);

    @Inject
    @ConfigProperty(name = "dns-cache.name", defaultValue = "dns-cache")
    String cacheName;

    @Inject
    @ConfigProperty(name = "dns-cache.capacity", defaultValue = "10000")
    int capacity;

    @Inject
    @ConfigProperty(name = "dns-cache.max-detached-entries", defaultValue = "10000")
    int maxDetachedEntries;

    @Inject
    @ConfigProperty(name = "dns-cache.sweep-mode", defaultValue = "full-scan")
    String sweepMode;

    @Inject
    @ConfigProperty(name = "dns-cache.sweep-period-seconds", defaultValue = "5")
    long sweepPeriodSeconds;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @Singleton
    public CacheConfig cacheConfig() {
        CacheConfig config = CacheConfig.builder()
                .capacity(capacity)
                .maxDetachedEntries(maxDetachedEntries)
                .sweepMode(parseSweepMode(sweepMode))
                .build();
        log.info("Cache config: name={} capacity={} maxDetachedEntries={} sweepMode={}",
                cacheName, config.capacity(), config.maxDetachedEntries(), config.sweepMode());
        return config;
    }

    @Produces
    @Singleton
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Publishing cache metrics to Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public AddressCache addressCache(CacheConfig config, MetricsService metrics) {
        try (LogContext ignored = LogContext.forLifecycle(cacheName, "create")
                .with("capacity", String.valueOf(config.capacity()))) {
            if (!config.isEnabled()) {
                log.info("Address cache disabled (capacity={})", config.capacity());
            }
            return AddressCache.create(config, metrics);
        }
    }

    public void closeAddressCache(@Disposes AddressCache cache) {
        try (LogContext ignored = LogContext.forLifecycle(cacheName, "close")) {
            log.info("Closing address cache");
            cache.close();
        }
    }

    @Produces
    @Singleton
    public ExpirySweeper expirySweeper(AddressCache cache) {
        ExpirySweeper sweeper = new ExpirySweeper(cache, cacheName, Duration.ofSeconds(Math.max(1, sweepPeriodSeconds)));
        if (sweepPeriodSeconds > 0 && cache.capacity() > 0) {
            sweeper.start();
        } else {
            log.info("Background expiry sweeps disabled; expired entries are dropped on read only");
        }
        return sweeper;
    }

    public void closeExpirySweeper(@Disposes ExpirySweeper sweeper) {
        sweeper.close();
    }

    @Produces
    @Singleton
    public HealthCheckRegistry healthCheckRegistry(AddressCache cache, CacheConfig config) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new AddressCacheHealthCheck(cache, config.maxDetachedEntries()));
        return registry;
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    static SweepMode parseSweepMode(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return SweepMode.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            log.warn("Unknown sweep mode '{}', falling back to {}", value, SweepMode.FULL_SCAN);
            return SweepMode.FULL_SCAN;
        }
    }
}
