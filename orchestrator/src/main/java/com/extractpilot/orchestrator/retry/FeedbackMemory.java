package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.model.StepKind;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Improvement operations carried from one attempt to the next, per step-kind.
 *
 * Operations are compared after trimming and lower-casing; a repeat is
 * dropped and the first spelling is kept. Each step-kind holds at most
 * {@code capacity} operations. Once full, the oldest operation is evicted
 * to make room for the newest, so the prompt always sees the latest advice.
 */
public class FeedbackMemory {

    private final int capacity;
    private final Map<StepKind, Deque<String>> operations = new EnumMap<>(StepKind.class);

    public FeedbackMemory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Add operations in order, skipping blanks and duplicates.
     *
     * @return how many operations were stored
     */
    public int add(StepKind kind, List<String> improvementOps) {
        if (improvementOps == null || improvementOps.isEmpty()) {
            return 0;
        }
        Deque<String> stored = operations.computeIfAbsent(kind, k -> new ArrayDeque<>());
        int added = 0;
        for (String op : improvementOps) {
            if (op == null || op.isBlank() || contains(stored, op)) {
                continue;
            }
            if (stored.size() == capacity) {
                stored.removeFirst();
            }
            stored.addLast(op.strip());
            added++;
        }
        return added;
    }

    /** Stored operations for the step-kind, oldest first. */
    public List<String> get(StepKind kind) {
        Deque<String> stored = operations.get(kind);
        return stored == null ? List.of() : List.copyOf(stored);
    }

    public int capacity() {
        return capacity;
    }

    public void clear(StepKind kind) {
        operations.remove(kind);
    }

    static String normalize(String op) {
        return op.strip().toLowerCase(Locale.ROOT);
    }

    private static boolean contains(Deque<String> stored, String op) {
        String key = normalize(op);
        for (Iterator<String> it = stored.iterator(); it.hasNext(); ) {
            if (normalize(it.next()).equals(key)) {
                return true;
            }
        }
        return false;
    }
}
