package com.dns.cache.core.model;

import java.util.Objects;

/**
 * Composite index key: domain name plus record type.
 * Domains are compared exactly; no case folding or trailing-dot normalization is applied.
 *
 * @param domain     the domain name
 * @param recordType the record type
 */
public record CacheKey(String domain, RecordType recordType) {

    public CacheKey {
        Objects.requireNonNull(domain, "domain is required");
        Objects.requireNonNull(recordType, "recordType is required");
    }

    @Override
    public String toString() {
        return domain + "/" + recordType;
    }
}
