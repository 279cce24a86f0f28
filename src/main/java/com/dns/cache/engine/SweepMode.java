package com.dns.cache.engine;

/**
 * Strategy used by {@link AddressCache#invalidateExpired()} to walk the recency list.
 */
public enum SweepMode {

    /**
     * Visit every entry. Catches entries that expired behind a long-lived entry
     * which was touched back toward the head.
     */
    FULL_SCAN,

    /**
     * Stop at the first entry that is still fresh. Bounded cost, but an expired entry
     * sitting behind a fresh one waits for a later sweep or a lazy expiry on read.
     */
    STOP_AT_FIRST_FRESH
}
