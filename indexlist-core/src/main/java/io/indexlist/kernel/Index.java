package io.indexlist.kernel;

/**
 * Opaque handle to an element of an {@link IndexList}.
 * <p>
 * Pairs a slot position with the list generation the slot was stamped with when
 * the element was inserted. A handle stays valid until its element is removed and
 * never becomes valid again, even after the slot is reused. The type parameter
 * ties the handle to the list's value type; it carries no runtime state.
 *
 * @param <T> value type of the list that issued this handle
 */
public final class Index<T> {

    private final int position;
    private final long generation;

    Index(int position, long generation) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative: " + position);
        }
        if (generation < 0) {
            throw new IllegalArgumentException("generation must be non-negative: " + generation);
        }
        this.position = position;
        this.generation = generation;
    }

    int position() {
        return position;
    }

    long generation() {
        return generation;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Index<?> other = (Index<?>) obj;
        return position == other.position && generation == other.generation;
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(position) + Long.hashCode(generation);
    }

    @Override
    public String toString() {
        return "Index{position=" + position + ", generation=" + generation + "}";
    }
}
