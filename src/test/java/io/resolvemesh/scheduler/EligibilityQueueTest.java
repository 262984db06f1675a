package io.resolvemesh.scheduler;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class EligibilityQueueTest {

    @Test
    void pollsDueRequestsInTimeOrder() {
        EligibilityQueue queue = new EligibilityQueue();
        queue.schedule("b", 200L);
        queue.schedule("a", 100L);
        queue.schedule("c", 300L);

        Assertions.assertEquals(List.of(), queue.pollDue(99L));
        Assertions.assertEquals(List.of("a", "b"), queue.pollDue(200L));
        Assertions.assertEquals(1, queue.size());
        Assertions.assertEquals(300L, queue.dueAt("c"));
    }

    @Test
    void reschedulingReplacesThePreviousDueTime() {
        EligibilityQueue queue = new EligibilityQueue();
        queue.schedule("a", 100L);
        queue.schedule("a", 500L);
        Assertions.assertEquals(1, queue.size());
        Assertions.assertEquals(List.of(), queue.pollDue(100L));
        Assertions.assertEquals(List.of("a"), queue.pollDue(500L));

        queue.schedule("b", 500L);
        queue.schedule("b", Long.MIN_VALUE);
        Assertions.assertEquals(List.of("b"), queue.pollDue(0L));
        Assertions.assertEquals(List.of(), queue.pollDue(Long.MAX_VALUE));
    }

    @Test
    void removedAndClearedEntriesAreNeverReturned() {
        EligibilityQueue queue = new EligibilityQueue();
        queue.schedule("a", 1L);
        queue.schedule("b", 2L);
        queue.remove("a");
        Assertions.assertNull(queue.dueAt("a"));
        Assertions.assertEquals(List.of("b"), queue.pollDue(10L));

        queue.schedule("c", 1L);
        queue.clear();
        Assertions.assertEquals(0, queue.size());
        Assertions.assertEquals(List.of(), queue.pollDue(10L));
    }
}
