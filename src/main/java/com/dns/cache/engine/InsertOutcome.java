package com.dns.cache.engine;

/**
 * Result of a successful {@link AddressCache#insert} call.
 * Failures are reported by exception, never through this enum.
 */
public enum InsertOutcome {
    /** A new entry was linked into the cache. */
    INSERTED,
    /** A fresh entry for the same domain and type already exists; it was kept as is. */
    ALREADY_PRESENT,
    /** The cache is disabled and stores nothing. */
    DISABLED
}
