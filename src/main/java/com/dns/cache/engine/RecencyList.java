package com.dns.cache.engine;

/**
 * Doubly-linked list of entry slots ordered by last touch, oldest at the head.
 * Links live in the entries themselves. Guarded by the cache lock.
 */
final class RecencyList {

    private final EntryArena arena;
    private int head = CacheEntry.NIL;
    private int tail = CacheEntry.NIL;
    private int size;

    RecencyList(EntryArena arena) {
        this.arena = arena;
    }

    void append(CacheEntry entry) {
        entry.prev = tail;
        entry.next = CacheEntry.NIL;
        if (tail == CacheEntry.NIL) {
            head = entry.slot;
        } else {
            arena.get(tail).next = entry.slot;
        }
        tail = entry.slot;
        entry.linked = true;
        size++;
    }

    void remove(CacheEntry entry) {
        if (!entry.linked) {
            return;
        }
        if (entry.prev == CacheEntry.NIL) {
            head = entry.next;
        } else {
            arena.get(entry.prev).next = entry.next;
        }
        if (entry.next == CacheEntry.NIL) {
            tail = entry.prev;
        } else {
            arena.get(entry.next).prev = entry.prev;
        }
        entry.prev = CacheEntry.NIL;
        entry.next = CacheEntry.NIL;
        entry.linked = false;
        size--;
    }

    void moveToTail(CacheEntry entry) {
        if (entry.slot == tail) {
            return;
        }
        remove(entry);
        append(entry);
    }

    CacheEntry first() {
        return arena.get(head);
    }

    CacheEntry next(CacheEntry entry) {
        return arena.get(entry.next);
    }

    void clear() {
        CacheEntry entry = first();
        while (entry != null) {
            CacheEntry next = next(entry);
            entry.prev = CacheEntry.NIL;
            entry.next = CacheEntry.NIL;
            entry.linked = false;
            entry = next;
        }
        head = CacheEntry.NIL;
        tail = CacheEntry.NIL;
        size = 0;
    }

    int size() {
        return size;
    }
}
