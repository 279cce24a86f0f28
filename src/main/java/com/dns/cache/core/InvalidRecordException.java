package com.dns.cache.core;

/**
 * Thrown when a record offered to the cache fails validation: unsupported record type,
 * address length not matching the type, domain out of bounds or a negative TTL.
 * Validation always runs before any structural change, so the cache is untouched.
 */
public class InvalidRecordException extends DnsCacheException {

    public InvalidRecordException(String message) {
        super(message);
    }
}
