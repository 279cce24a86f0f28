package com.dns.cache.engine;

import com.dns.cache.core.DnsCacheException;

/**
 * Thrown when a handle no longer refers to the entry it was issued for,
 * typically because it was already released.
 */
public class StaleHandleException extends DnsCacheException {

    public StaleHandleException(String message) {
        super(message);
    }
}
