package com.dns.cache.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs registered health checks and folds them into one status: the worst individual
 * status wins, and each check's result is attached as a detail under its name.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final Map<String, HealthCheck> checks = new LinkedHashMap<>();

    /**
     * Registers a check, replacing any earlier check with the same name.
     */
    public synchronized void register(HealthCheck check) {
        if (check != null) {
            checks.put(check.getName(), check);
        }
    }

    public synchronized HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, Object> results = new LinkedHashMap<>();

        for (HealthCheck check : checks.values()) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, results);
    }

    public synchronized int size() {
        return checks.size();
    }

    private HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            log.warn("health.check.failed name={}: {}", check.getName(), e.getMessage());
            return HealthStatus.down("Health check threw " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }
}
