package com.dns.cache.engine;

import com.dns.cache.core.model.AddressRecord;

import java.util.Objects;

/**
 * Caller-owned reference to a cached entry, returned by {@link AddressCache#get}.
 *
 * <p>Each handle holds one reference on its entry and must be given back exactly once
 * with {@link AddressCache#release(CacheHandle)}. After that the handle is consumed;
 * the slot/generation pair lets the cache reject it if it is used again.</p>
 *
 * @param slot       arena slot of the entry
 * @param generation allocation generation of the entry in that slot
 * @param record     the immutable record payload
 */
public record CacheHandle(int slot, long generation, AddressRecord record) {

    public CacheHandle {
        Objects.requireNonNull(record, "record is required");
    }
}
