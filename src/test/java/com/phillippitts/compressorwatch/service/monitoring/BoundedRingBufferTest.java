package com.phillippitts.compressorwatch.service.monitoring;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedRingBufferTest {

    @Test
    void keepsNewestEntriesInInsertionOrderWhenFull() {
        BoundedRingBuffer<Integer> buffer = new BoundedRingBuffer<>(1000);

        IntStream.rangeClosed(1, 1500).forEach(buffer::add);

        List<Integer> all = buffer.snapshot();
        assertThat(buffer.size()).isEqualTo(1000);
        assertThat(all).hasSize(1000);
        assertThat(all.get(0)).isEqualTo(501);
        assertThat(all.get(999)).isEqualTo(1500);
        assertThat(all).isSorted();
    }

    @Test
    void lastNReturnsTailOldestFirst() {
        BoundedRingBuffer<String> buffer = new BoundedRingBuffer<>(3);
        buffer.add("a");
        buffer.add("b");
        buffer.add("c");
        buffer.add("d");

        assertThat(buffer.lastN(2)).containsExactly("c", "d");
        assertThat(buffer.lastN(10)).containsExactly("b", "c", "d");
        assertThat(buffer.lastN(0)).isEmpty();
        assertThat(buffer.lastN(-5)).isEmpty();
    }

    @Test
    void returnedListsAreDetachedAndReadOnly() {
        BoundedRingBuffer<String> buffer = new BoundedRingBuffer<>(4);
        buffer.add("x");

        List<String> view = buffer.snapshot();
        buffer.add("y");

        assertThat(view).containsExactly("x");
        assertThatThrownBy(() -> view.add("z")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void singleSlotAlwaysHoldsNewest() {
        BoundedRingBuffer<Integer> buffer = new BoundedRingBuffer<>(1);

        IntStream.rangeClosed(1, 5).forEach(buffer::add);

        assertThat(buffer.size()).isEqualTo(1);
        assertThat(buffer.lastN(3)).containsExactly(5);
    }

    @Test
    void clearEmptiesTheBuffer() {
        BoundedRingBuffer<Integer> buffer = new BoundedRingBuffer<>(2);
        buffer.add(1);
        buffer.add(2);

        buffer.clear();
        buffer.add(3);

        assertThat(buffer.snapshot()).containsExactly(3);
    }

    @Test
    void rejectsInvalidCapacityAndNullItems() {
        assertThatThrownBy(() -> new BoundedRingBuffer<String>(0)).isInstanceOf(IllegalArgumentException.class);
        BoundedRingBuffer<String> buffer = new BoundedRingBuffer<>(1);
        assertThatThrownBy(() -> buffer.add(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
