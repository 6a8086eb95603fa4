package com.tinypool.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResultQueue.
 */
class ResultQueueTest {

    @Test
    @DisplayName("Should drain in arrival order and leave the queue empty")
    void shouldDrainInOrder() {
        ResultQueue<String> queue = new ResultQueue<>();
        queue.add("x");
        queue.add("y");

        assertEquals(2, queue.size());
        assertEquals(List.of("x", "y"), queue.drain());
        assertEquals(0, queue.size());
        assertTrue(queue.drain().isEmpty());
    }

    @Test
    @DisplayName("Drained list is independent of the queue")
    void drainedListIsDetached() {
        ResultQueue<String> queue = new ResultQueue<>();
        queue.add("x");
        List<String> drained = queue.drain();

        queue.add("y");

        assertEquals(List.of("x"), drained);
    }

    @Test
    @DisplayName("Should reject null results")
    void shouldRejectNull() {
        assertThrows(NullPointerException.class, () -> new ResultQueue<String>().add(null));
    }
}
