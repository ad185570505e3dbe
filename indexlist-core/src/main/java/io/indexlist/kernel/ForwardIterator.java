package io.indexlist.kernel;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static io.indexlist.kernel.SlotArena.NONE;

/**
 * Borrowing head-to-tail iterator over an {@link IndexList}.
 * <p>
 * With fail-fast iteration disabled, the upcoming element is remembered by position and
 * generation stamp. If that element was removed (and possibly its slot reused) since the
 * previous step, the iterator throws {@link ConcurrentModificationException} instead of
 * following a stale link.
 */
final class ForwardIterator<T> implements Iterator<T> {

    private final IndexList<T> list;
    private final SlotArena<T> arena;
    private final int expectedModCount;
    private int nextPosition;
    private long nextGeneration;

    ForwardIterator(IndexList<T> list, int head) {
        this.list = list;
        this.arena = list.arena();
        this.expectedModCount = list.modCount();
        this.nextPosition = head;
        this.nextGeneration = arena.generationAt(head);
    }

    @Override
    public boolean hasNext() {
        checkForComodification();
        return nextPosition != NONE;
    }

    @Override
    public T next() {
        checkForComodification();
        if (nextPosition == NONE) {
            throw new NoSuchElementException();
        }
        var entry = upcoming();
        nextPosition = entry.next;
        nextGeneration = arena.generationAt(nextPosition);
        return entry.value;
    }

    private Slot.Occupied<T> upcoming() {
        if (list.failFastIteration() || list.modCount() == expectedModCount) {
            return arena.occupied(nextPosition, "next");
        }
        var entry = arena.lookup(nextPosition, nextGeneration);
        if (entry == null) {
            throw new ConcurrentModificationException(
                    "element at position " + nextPosition + " was removed during iteration");
        }
        return entry;
    }

    private void checkForComodification() {
        if (list.failFastIteration() && list.modCount() != expectedModCount) {
            throw new ConcurrentModificationException();
        }
    }
}
