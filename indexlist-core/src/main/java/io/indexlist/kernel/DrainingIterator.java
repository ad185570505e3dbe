package io.indexlist.kernel;

import java.util.Iterator;
import java.util.NoSuchElementException;

import static io.indexlist.kernel.SlotArena.NONE;

/**
 * Consuming head-to-tail iterator. Owns the arena detached from the drained list
 * and clears each slot as it is visited.
 */
final class DrainingIterator<T> implements Iterator<T> {

    private final SlotArena<T> arena;
    private int nextPosition;

    DrainingIterator(SlotArena<T> arena, int head) {
        this.arena = arena;
        this.nextPosition = head;
    }

    @Override
    public boolean hasNext() {
        return nextPosition != NONE;
    }

    @Override
    public T next() {
        if (nextPosition == NONE) {
            throw new NoSuchElementException();
        }
        var position = nextPosition;
        if (!(arena.take(position) instanceof Slot.Occupied<T> entry)) {
            nextPosition = NONE;
            throw SlotArena.corrupted("free slot " + position + " reached while draining");
        }
        nextPosition = entry.next;
        return entry.value;
    }
}
