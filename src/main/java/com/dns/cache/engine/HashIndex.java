package com.dns.cache.engine;

import com.dns.cache.core.model.CacheKey;

import java.util.HashMap;
import java.util.Map;

/**
 * Key to slot index over the arena. Guarded by the cache lock.
 */
final class HashIndex {

    private final EntryArena arena;
    private final Map<CacheKey, Integer> slotsByKey;

    HashIndex(EntryArena arena, int expectedSize) {
        this.arena = arena;
        this.slotsByKey = new HashMap<>(Math.max(16, (int) Math.min(1 << 20, expectedSize * 4L / 3 + 1)));
    }

    CacheEntry find(CacheKey key) {
        Integer slot = slotsByKey.get(key);
        return slot == null ? null : arena.get(slot);
    }

    void add(CacheEntry entry) {
        Integer previous = slotsByKey.putIfAbsent(entry.key, entry.slot);
        if (previous != null) {
            throw new IllegalStateException("Key already indexed: " + entry.key);
        }
    }

    void remove(CacheEntry entry) {
        slotsByKey.remove(entry.key, entry.slot);
    }

    void clear() {
        slotsByKey.clear();
    }

    int size() {
        return slotsByKey.size();
    }
}
