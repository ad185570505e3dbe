package io.indexlist.kernel;

import io.indexlist.core.CorruptedListException;
import org.junit.jupiter.api.Test;

import static io.indexlist.kernel.SlotArena.NONE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotArenaTest {

    private static Slot.Occupied<String> entry(String value, long generation) {
        return new Slot.Occupied<>(value, generation, NONE, NONE);
    }

    @Test
    void newArenaIsEmpty() {
        SlotArena<String> arena = new SlotArena<>(10);

        assertThat(arena.length()).isZero();
        assertThat(arena.capacity()).isEqualTo(10);
        assertThat(arena.nextFree()).isEqualTo(NONE);
    }

    @Test
    void appendsWhenFreeListIsEmpty() {
        SlotArena<String> arena = new SlotArena<>(0);

        assertThat(arena.allocate(entry("a", 0))).isEqualTo(0);
        assertThat(arena.allocate(entry("b", 0))).isEqualTo(1);
        assertThat(arena.allocate(entry("c", 0))).isEqualTo(2);

        assertThat(arena.length()).isEqualTo(3);
        assertThat(arena.capacity()).isGreaterThanOrEqualTo(3);
    }

    @Test
    void growsPastInitialCapacity() {
        SlotArena<Integer> arena = new SlotArena<>(2);

        for (int i = 0; i < 100; i++) {
            assertThat(arena.allocate(new Slot.Occupied<>(i, 0, NONE, NONE))).isEqualTo(i);
        }

        assertThat(arena.length()).isEqualTo(100);
        assertThat(arena.lookup(99, 0).value).isEqualTo(99);
    }

    @Test
    void releasedSlotsAreReusedLastInFirstOut() {
        SlotArena<String> arena = new SlotArena<>(0);
        arena.allocate(entry("a", 0));
        arena.allocate(entry("b", 0));
        arena.allocate(entry("c", 0));

        assertThat(arena.release(0).value).isEqualTo("a");
        assertThat(arena.release(2).value).isEqualTo("c");
        assertThat(arena.nextFree()).isEqualTo(2);

        assertThat(arena.allocate(entry("d", 2))).isEqualTo(2);
        assertThat(arena.allocate(entry("e", 2))).isEqualTo(0);
        assertThat(arena.nextFree()).isEqualTo(NONE);
        assertThat(arena.allocate(entry("f", 2))).isEqualTo(3);
        assertThat(arena.length()).isEqualTo(4);
    }

    @Test
    void lookupRejectsOutOfRangeFreeAndStale() {
        SlotArena<String> arena = new SlotArena<>(0);
        arena.allocate(entry("a", 0));
        arena.allocate(entry("b", 0));
        arena.release(1);

        assertThat(arena.lookup(0, 0).value).isEqualTo("a");
        assertThat(arena.lookup(0, 1)).isNull();
        assertThat(arena.lookup(1, 0)).isNull();
        assertThat(arena.lookup(2, 0)).isNull();
        assertThat(arena.lookup(-1, 0)).isNull();
    }

    @Test
    void dereferencingFreeSlotIsCorruption() {
        SlotArena<String> arena = new SlotArena<>(0);
        arena.allocate(entry("a", 0));
        arena.release(0);

        assertThatThrownBy(() -> arena.occupied(0, "next"))
                .isInstanceOf(CorruptedListException.class)
                .hasMessageContaining("free slot 0");
        assertThatThrownBy(() -> arena.release(0))
                .isInstanceOf(CorruptedListException.class);
    }

    @Test
    void takeLeavesUnlinkedFreeMarker() {
        SlotArena<String> arena = new SlotArena<>(0);
        arena.allocate(entry("a", 0));

        Slot<String> taken = arena.take(0);

        assertThat(taken).isInstanceOf(Slot.Occupied.class);
        assertThat(arena.take(0)).isEqualTo(new Slot.Free<String>(NONE));
        assertThat(arena.nextFree()).isEqualTo(NONE);
    }

    @Test
    void growthDoublesFromSmallSizes() {
        assertThat(SlotArena.grownCapacity(0, 1)).isEqualTo(8);
        assertThat(SlotArena.grownCapacity(8, 9)).isEqualTo(16);
        assertThat(SlotArena.grownCapacity(16, 100)).isEqualTo(100);
    }

    @Test
    void growthNearIntegerLimitIsClampedInsteadOfOverflowing() {
        var huge = (1 << 30) + 1;

        assertThat(SlotArena.grownCapacity(huge, huge + 1)).isEqualTo(Integer.MAX_VALUE - 8);
        assertThat(SlotArena.grownCapacity(Integer.MAX_VALUE - 9, Integer.MAX_VALUE - 8))
                .isEqualTo(Integer.MAX_VALUE - 8);
    }

    @Test
    void growthBeyondMaximumIsRejected() {
        assertThatThrownBy(() -> SlotArena.grownCapacity(Integer.MAX_VALUE - 8, Integer.MAX_VALUE - 7))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("capacity exceeded");
        assertThatThrownBy(() -> SlotArena.grownCapacity(Integer.MAX_VALUE - 8, Integer.MIN_VALUE))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNegativeCapacity() {
        assertThatThrownBy(() -> new SlotArena<String>(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
