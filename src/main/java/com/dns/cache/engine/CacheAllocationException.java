package com.dns.cache.engine;

import com.dns.cache.core.DnsCacheException;

/**
 * Thrown when the cache cannot allocate an entry slot because every slot is taken
 * by a live entry or by an entry callers still hold. The cache is left unchanged.
 */
public class CacheAllocationException extends DnsCacheException {

    public CacheAllocationException(String message) {
        super(message);
    }
}
