package io.indexlist.kernel;

import io.indexlist.core.IndexListConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Iterator;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static io.indexlist.kernel.SlotArena.NONE;

/**
 * Order-preserving list backed by a slot arena, addressed through generation-checked handles.
 * <p>
 * Provides:
 * <ul>
 *   <li>O(1) push to either end, returning an {@link Index} handle</li>
 *   <li>O(1) lookup and removal by handle</li>
 *   <li>Slot reuse through an intrusive free list (no growth under churn)</li>
 *   <li>Stale-handle detection: a removed element's handle stays absent forever</li>
 * </ul>
 * <p>
 * Traversal order is kept by a doubly-linked chain of arena positions, independent of
 * where elements physically live. The list generation starts at zero and increases by
 * one on every successful removal; each element is stamped with the generation current
 * at its insertion, and a handle resolves only while the stamps match.
 * <p>
 * Values must be non-null. The list is single-threaded; callers synchronize externally.
 *
 * @param <T> element type
 */
public final class IndexList<T> implements Iterable<T> {

    private static final Logger log = LoggerFactory.getLogger(IndexList.class);

    private final boolean failFastIteration;

    private SlotArena<T> arena;
    private long generation;
    private int head = NONE;
    private int tail = NONE;
    private int size;
    private int modCount;
    private boolean drained;

    /**
     * Create an empty list with default configuration.
     */
    public IndexList() {
        this(IndexListConfiguration.defaults());
    }

    /**
     * Create an empty list.
     *
     * @param configuration list configuration
     */
    public IndexList(IndexListConfiguration configuration) {
        if (configuration == null) {
            throw new IllegalArgumentException("configuration required");
        }
        this.arena = new SlotArena<>(configuration.initialCapacity());
        this.failFastIteration = configuration.failFastIteration();
        if (log.isDebugEnabled()) {
            log.debug("Created index list (initialCapacity={}, failFastIteration={})",
                    configuration.initialCapacity(), failFastIteration);
        }
    }

    /**
     * Create an empty list with room for {@code capacity} elements before the slot array grows.
     *
     * @param capacity expected element count (hint, not a bound)
     * @return a new empty list
     */
    public static <T> IndexList<T> withCapacity(int capacity) {
        return new IndexList<>(IndexListConfiguration.builder().initialCapacity(capacity).build());
    }

    /**
     * Append a value after the current tail.
     *
     * @param value value to store
     * @return handle to the stored value
     */
    public Index<T> pushBack(T value) {
        checkPushable(value);
        var position = arena.allocate(new Slot.Occupied<>(value, generation, NONE, tail));
        if (tail != NONE) {
            arena.occupied(tail, "tail").next = position;
        }
        if (head == NONE) {
            head = position;
        }
        tail = position;
        size++;
        modCount++;
        return new Index<>(position, generation);
    }

    /**
     * Prepend a value before the current head.
     *
     * @param value value to store
     * @return handle to the stored value
     */
    public Index<T> pushFront(T value) {
        checkPushable(value);
        var position = arena.allocate(new Slot.Occupied<>(value, generation, head, NONE));
        // Old head gains a predecessor; the tail is untouched unless the list was empty
        if (head != NONE) {
            arena.occupied(head, "head").prev = position;
        }
        if (tail == NONE) {
            tail = position;
        }
        head = position;
        size++;
        modCount++;
        return new Index<>(position, generation);
    }

    /**
     * Look up the value for a handle.
     *
     * @param index handle returned by a push
     * @return the value, or empty if the handle is stale or unknown
     */
    public Optional<T> get(Index<T> index) {
        var entry = resolve(index);
        return entry == null ? Optional.empty() : Optional.of(entry.value);
    }

    /**
     * Check whether a handle still resolves to a live element.
     */
    public boolean contains(Index<T> index) {
        return resolve(index) != null;
    }

    /**
     * Overwrite the value for a handle in place. Order and handle are unchanged.
     *
     * @param index handle returned by a push
     * @param value new value
     * @return the previous value, or empty (and no change) if the handle is stale
     */
    public Optional<T> replace(Index<T> index, T value) {
        requireValue(value);
        var entry = resolve(index);
        if (entry == null) {
            return Optional.empty();
        }
        var previous = entry.value;
        entry.value = value;
        return Optional.of(previous);
    }

    /**
     * Apply a function to the value for a handle and store the result.
     *
     * @param index   handle returned by a push
     * @param updater function producing the new value (must not return null)
     * @return the new value, or empty if the handle is stale
     */
    public Optional<T> update(Index<T> index, UnaryOperator<T> updater) {
        if (updater == null) {
            throw new IllegalArgumentException("updater required");
        }
        return apply(resolve(index), updater);
    }

    /**
     * Get the first value in traversal order.
     */
    public Optional<T> head() {
        return head == NONE ? Optional.empty() : Optional.of(arena.occupied(head, "head").value);
    }

    /**
     * Get the last value in traversal order.
     */
    public Optional<T> tail() {
        return tail == NONE ? Optional.empty() : Optional.of(arena.occupied(tail, "tail").value);
    }

    /**
     * Apply a function to the head value and store the result.
     *
     * @return the new head value, or empty if the list is empty
     */
    public Optional<T> updateHead(UnaryOperator<T> updater) {
        if (updater == null) {
            throw new IllegalArgumentException("updater required");
        }
        return apply(head == NONE ? null : arena.occupied(head, "head"), updater);
    }

    /**
     * Apply a function to the tail value and store the result.
     *
     * @return the new tail value, or empty if the list is empty
     */
    public Optional<T> updateTail(UnaryOperator<T> updater) {
        if (updater == null) {
            throw new IllegalArgumentException("updater required");
        }
        return apply(tail == NONE ? null : arena.occupied(tail, "tail"), updater);
    }

    /**
     * Remove the element for a handle.
     * <p>
     * Relinks both neighbours, moves head/tail when an endpoint is removed, frees the slot
     * for reuse and advances the list generation. Removing an already-removed handle
     * returns empty and changes nothing.
     *
     * @param index handle returned by a push
     * @return the removed value, or empty if the handle is stale or unknown
     */
    public Optional<T> remove(Index<T> index) {
        requireIndex(index);
        if (head == NONE || tail == NONE) {
            return Optional.empty();
        }
        var position = index.position();
        var entry = arena.lookup(position, index.generation());
        if (entry == null) {
            return Optional.empty();
        }

        var prev = entry.prev;
        var next = entry.next;
        if (prev != NONE) {
            arena.occupied(prev, "prev").next = next;
        } else {
            head = next;
        }
        if (next != NONE) {
            arena.occupied(next, "next").prev = prev;
        } else {
            tail = prev;
        }

        arena.release(position);
        generation++;
        size--;
        modCount++;
        return Optional.of(entry.value);
    }

    /**
     * Borrowing head-to-tail iterator. Does not modify the list.
     * <p>
     * Unless fail-fast iteration is disabled, a push, successful remove or drain made
     * while the iterator is open causes its next call to throw
     * {@link java.util.ConcurrentModificationException}.
     */
    @Override
    public Iterator<T> iterator() {
        return new ForwardIterator<>(this, head);
    }

    /**
     * Sequential ordered stream over the borrowing traversal.
     */
    public Stream<T> stream() {
        return StreamSupport.stream(
                Spliterators.spliterator(iterator(), size, Spliterator.ORDERED | Spliterator.NONNULL),
                false);
    }

    /**
     * Consume the list head to tail.
     * <p>
     * Ownership of every element moves to the returned iterator and this list becomes an
     * empty shell: lookups report absence and further pushes throw
     * {@link IllegalStateException}. Each visited slot is cleared as the iterator advances.
     *
     * @return iterator yielding every element exactly once, in order
     */
    public Iterator<T> drain() {
        if (drained) {
            return Collections.emptyIterator();
        }
        var detached = arena;
        var first = head;
        if (log.isDebugEnabled()) {
            log.debug("Draining index list of {} elements", size);
        }
        arena = new SlotArena<>(0);
        head = NONE;
        tail = NONE;
        size = 0;
        modCount++;
        drained = true;
        return new DrainingIterator<>(detached, first);
    }

    /**
     * Number of live elements.
     */
    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Current list generation: the number of successful removals so far.
     */
    public long generation() {
        return generation;
    }

    /**
     * Number of slots ever allocated, live or free. Never shrinks under churn.
     */
    public int slotCount() {
        return arena.length();
    }

    @Override
    public String toString() {
        var builder = new StringBuilder("IndexList[");
        var position = head;
        var first = true;
        while (position != NONE) {
            var entry = arena.occupied(position, "next");
            if (!first) {
                builder.append(", ");
            }
            builder.append(entry.value);
            first = false;
            position = entry.next;
        }
        return builder.append(']').toString();
    }

    SlotArena<T> arena() {
        return arena;
    }

    int headPosition() {
        return head;
    }

    int tailPosition() {
        return tail;
    }

    int modCount() {
        return modCount;
    }

    boolean failFastIteration() {
        return failFastIteration;
    }

    private Slot.Occupied<T> resolve(Index<T> index) {
        requireIndex(index);
        return arena.lookup(index.position(), index.generation());
    }

    private Optional<T> apply(Slot.Occupied<T> entry, UnaryOperator<T> updater) {
        if (entry == null) {
            return Optional.empty();
        }
        var updated = updater.apply(entry.value);
        requireValue(updated);
        entry.value = updated;
        return Optional.of(updated);
    }

    private void checkPushable(T value) {
        requireValue(value);
        if (drained) {
            throw new IllegalStateException("index list has been drained");
        }
    }

    private static void requireValue(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value required");
        }
    }

    private static void requireIndex(Index<?> index) {
        if (index == null) {
            throw new IllegalArgumentException("index required");
        }
    }
}
