package io.resolvemesh.scheduler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Requests ordered by next-eligible time. One entry per request; rescheduling replaces the previous
 * due time. Not thread-safe: owned by the coordinator.
 */
final class EligibilityQueue {
    private final PriorityQueue<Entry> heap = new PriorityQueue<>(
            Comparator.comparingLong(Entry::dueAtMs).thenComparing(Entry::requestId));
    private final Map<String, Long> dueById = new HashMap<>();

    void schedule(String requestId, long dueAtMs) {
        Long previous = dueById.put(requestId, dueAtMs);
        if (previous == null || previous != dueAtMs) {
            heap.add(new Entry(requestId, dueAtMs));
        }
    }

    void remove(String requestId) {
        dueById.remove(requestId);
    }

    List<String> pollDue(long nowMs) {
        List<String> due = new ArrayList<>();
        while (!heap.isEmpty() && heap.peek().dueAtMs() <= nowMs) {
            Entry e = heap.poll();
            Long current = dueById.get(e.requestId());
            if (current != null && current == e.dueAtMs()) {
                dueById.remove(e.requestId());
                due.add(e.requestId());
            }
        }
        return due;
    }

    Long dueAt(String requestId) {
        return dueById.get(requestId);
    }

    int size() {
        return dueById.size();
    }

    void clear() {
        heap.clear();
        dueById.clear();
    }

    private record Entry(String requestId, long dueAtMs) {
    }
}
