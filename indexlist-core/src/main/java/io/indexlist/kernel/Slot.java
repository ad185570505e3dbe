package io.indexlist.kernel;

/**
 * One cell of a {@link SlotArena}: either a free-list link or a live element.
 */
sealed interface Slot<T> permits Slot.Free, Slot.Occupied {

    /**
     * Unused slot threaded into the free list.
     *
     * @param nextFree position of the next free slot, or {@link SlotArena#NONE}
     */
    record Free<T>(int nextFree) implements Slot<T> {
    }

    /**
     * Live element with its generation stamp and order links.
     * Links are arena positions, {@link SlotArena#NONE} when absent.
     */
    final class Occupied<T> implements Slot<T> {
        private final long generation;
        T value;
        int next;
        int prev;

        Occupied(T value, long generation, int next, int prev) {
            this.value = value;
            this.generation = generation;
            this.next = next;
            this.prev = prev;
        }

        long generation() {
            return generation;
        }

        @Override
        public String toString() {
            return "Occupied{value=" + value + ", generation=" + generation
                    + ", next=" + next + ", prev=" + prev + "}";
        }
    }
}
