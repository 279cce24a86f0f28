package com.dns.cache.health;

/**
 * A single named health check.
 */
public interface HealthCheck {

    String getName();

    /**
     * Checks the component. Implementations report failures as a DOWN status
     * rather than throwing.
     */
    HealthStatus check();
}
