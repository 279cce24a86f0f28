package com.dns.cache.core;

/**
 * Base runtime exception for address cache failures.
 */
public class DnsCacheException extends RuntimeException {

    public DnsCacheException(String message) {
        super(message);
    }

    public DnsCacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
