package io.indexlist.kernel;

import io.indexlist.core.CorruptedListException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Dense, growable slot store with an intrusive free list.
 * <p>
 * Positions are stable for the lifetime of the arena: the slot array only grows,
 * and a released slot is pushed onto the free list to be recycled by the next
 * allocation (LIFO). Free-list links are stored inside the {@link Slot.Free}
 * cells themselves, so membership in the free list and occupancy are exclusive
 * and together cover every position below {@link #length()}.
 * <p>
 * Not thread-safe.
 */
final class SlotArena<T> {

    /** Absent position marker for free-list and order links. */
    static final int NONE = -1;

    private static final Logger log = LoggerFactory.getLogger(SlotArena.class);
    private static final int MIN_GROWTH = 8;
    private static final int MAX_SLOTS = Integer.MAX_VALUE - 8;

    private Slot<T>[] slots;
    private int length;
    private int nextFree = NONE;

    SlotArena(int initialCapacity) {
        if (initialCapacity < 0) {
            throw new IllegalArgumentException("initialCapacity must be non-negative: " + initialCapacity);
        }
        this.slots = newSlotArray(initialCapacity);
    }

    /**
     * Place an occupied entry, reusing the free-list head when there is one.
     *
     * @param entry the entry to store
     * @return the position the entry was stored at
     */
    int allocate(Slot.Occupied<T> entry) {
        if (nextFree == NONE) {
            ensureCapacity(length + 1);
            var position = length++;
            slots[position] = entry;
            return position;
        }
        var position = nextFree;
        if (!(slots[position] instanceof Slot.Free<T> free)) {
            throw corrupted("occupied slot " + position + " at free-list head");
        }
        nextFree = free.nextFree();
        slots[position] = entry;
        return position;
    }

    /**
     * Resolve a caller-supplied position and generation.
     *
     * @return the occupied entry, or null when out of range, free or stale
     */
    Slot.Occupied<T> lookup(int position, long generation) {
        if (position < 0 || position >= length) {
            return null;
        }
        if (slots[position] instanceof Slot.Occupied<T> occupied && occupied.generation() == generation) {
            return occupied;
        }
        return null;
    }

    /**
     * Peek at the generation stamp of a slot without validating it.
     *
     * @return the stamp, or -1 when the position is {@link #NONE}, out of range or free
     */
    long generationAt(int position) {
        if (position >= 0 && position < length && slots[position] instanceof Slot.Occupied<T> occupied) {
            return occupied.generation();
        }
        return -1;
    }

    /**
     * Dereference an internal link. Links always point at occupied slots.
     *
     * @throws CorruptedListException if the slot is free
     */
    Slot.Occupied<T> occupied(int position, String link) {
        if (slots[position] instanceof Slot.Occupied<T> occupied) {
            return occupied;
        }
        throw corrupted("free slot " + position + " reached through " + link);
    }

    /**
     * Move an occupied slot onto the free list. Order links are not touched;
     * callers relink neighbours first.
     *
     * @return the entry that was stored at the position
     */
    Slot.Occupied<T> release(int position) {
        var entry = occupied(position, "release");
        slots[position] = new Slot.Free<>(nextFree);
        nextFree = position;
        return entry;
    }

    /**
     * Replace a slot with an unlinked free marker and return what it held.
     * Used by destructive traversal, which never reallocates afterwards.
     */
    Slot<T> take(int position) {
        var slot = slots[position];
        slots[position] = new Slot.Free<>(NONE);
        return slot;
    }

    int length() {
        return length;
    }

    int nextFree() {
        return nextFree;
    }

    int capacity() {
        return slots.length;
    }

    private void ensureCapacity(int neededCapacity) {
        if (neededCapacity <= slots.length) {
            return;
        }
        slots = Arrays.copyOf(slots, grownCapacity(slots.length, neededCapacity));
    }

    static int grownCapacity(int currentCapacity, int neededCapacity) {
        if (neededCapacity < 0 || neededCapacity > MAX_SLOTS) {
            throw new IllegalStateException("Slot capacity exceeded: " + MAX_SLOTS);
        }
        var doubled = Math.max((long) currentCapacity * 2L, MIN_GROWTH);
        return (int) Math.min(Math.max(doubled, neededCapacity), MAX_SLOTS);
    }

    static CorruptedListException corrupted(String message) {
        var exception = new CorruptedListException(message);
        log.error("Index list invariant violated: {}", message);
        return exception;
    }

    @SuppressWarnings("unchecked")
    private static <T> Slot<T>[] newSlotArray(int capacity) {
        return (Slot<T>[]) new Slot<?>[capacity];
    }
}
