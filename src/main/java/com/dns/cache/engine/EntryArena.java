package com.dns.cache.engine;

import com.dns.cache.core.model.AddressRecord;

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Slot storage for cache entries. The index and the recency list refer to entries by slot;
 * handles carry a slot plus a generation so a recycled slot cannot be mistaken for the
 * entry a handle was issued for.
 *
 * <p>{@link #allocate} and {@link #reset} must be called with the cache lock held.
 * {@link #get}, {@link #resolve} and {@link #free} are lock-free so that releasing a
 * handle never waits on structural changes.</p>
 */
final class EntryArena {

    private static final int INITIAL_SLOTS = 16;

    private final int slotLimit;
    private final ConcurrentLinkedDeque<Integer> freeSlots = new ConcurrentLinkedDeque<>();
    private final AtomicInteger allocated = new AtomicInteger(0);
    private final AtomicLong generations = new AtomicLong(0);
    private volatile AtomicReferenceArray<CacheEntry> slots;
    private int highWater;

    EntryArena(int slotLimit) {
        if (slotLimit <= 0) {
            throw new IllegalArgumentException("slotLimit must be > 0");
        }
        this.slotLimit = slotLimit;
        this.slots = new AtomicReferenceArray<>(Math.min(INITIAL_SLOTS, slotLimit));
    }

    CacheEntry allocate(AddressRecord record, long nowNanos) {
        Integer recycled = freeSlots.pollFirst();
        int slot;
        if (recycled != null) {
            slot = recycled;
        } else {
            if (highWater >= slotLimit) {
                throw new CacheAllocationException(
                        "No free entry slot: all " + slotLimit + " slots are in use");
            }
            slot = highWater++;
            if (slot >= slots.length()) {
                grow();
            }
        }
        CacheEntry entry = new CacheEntry(slot, generations.incrementAndGet(), record, nowNanos);
        slots.set(slot, entry);
        allocated.incrementAndGet();
        return entry;
    }

    CacheEntry get(int slot) {
        return slot == CacheEntry.NIL ? null : slots.get(slot);
    }

    /**
     * Looks up the live entry a handle was issued for.
     *
     * @throws StaleHandleException if the slot was freed or now holds a different entry
     */
    CacheEntry resolve(CacheHandle handle) {
        AtomicReferenceArray<CacheEntry> current = slots;
        int slot = handle.slot();
        CacheEntry entry = slot >= 0 && slot < current.length() ? current.get(slot) : null;
        if (entry == null || !entry.matches(handle)) {
            throw new StaleHandleException("Handle for " + handle.record().key() +
                    " (slot " + slot + ", generation " + handle.generation() + ") is no longer valid");
        }
        return entry;
    }

    void free(CacheEntry entry) {
        if (slots.compareAndSet(entry.slot, entry, null)) {
            freeSlots.offerLast(entry.slot);
            allocated.decrementAndGet();
        }
    }

    void reset() {
        freeSlots.clear();
        allocated.set(0);
        highWater = 0;
        slots = new AtomicReferenceArray<>(Math.min(INITIAL_SLOTS, slotLimit));
    }

    int allocatedCount() {
        return allocated.get();
    }

    int slotLimit() {
        return slotLimit;
    }

    private void grow() {
        AtomicReferenceArray<CacheEntry> old = slots;
        int newLength = (int) Math.min((long) old.length() * 2, slotLimit);
        AtomicReferenceArray<CacheEntry> grown = new AtomicReferenceArray<>(newLength);
        for (int i = 0; i < old.length(); i++) {
            grown.set(i, old.get(i));
        }
        slots = grown;
    }
}
