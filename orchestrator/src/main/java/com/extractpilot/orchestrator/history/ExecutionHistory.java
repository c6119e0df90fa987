package com.extractpilot.orchestrator.history;

import com.extractpilot.orchestrator.model.StepKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;

/**
 * Append-only log of every attempt of one run, in execution order.
 *
 * Records are never modified or removed. Listeners are told about each
 * record as it is appended; the run service uses one to persist attempts
 * while the run is still executing. A listener that throws aborts the
 * append before the record becomes visible.
 *
 * Not thread-safe: one history belongs to one run on one worker thread.
 */
public class ExecutionHistory {

    private final List<StepExecutionRecord>          records   = new ArrayList<>();
    private final List<Consumer<StepExecutionRecord>> listeners = new ArrayList<>();

    public ExecutionHistory onAppend(Consumer<StepExecutionRecord> listener) {
        listeners.add(listener);
        return this;
    }

    public void append(StepExecutionRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        listeners.forEach(l -> l.accept(record));
        records.add(record);
    }

    public List<StepExecutionRecord> records() {
        return Collections.unmodifiableList(records);
    }

    /** Records appended at or after {@code index}, as an immutable copy. */
    public List<StepExecutionRecord> since(int index) {
        return List.copyOf(records.subList(Math.min(index, records.size()), records.size()));
    }

    public List<StepExecutionRecord> forStep(StepKind kind) {
        return records.stream().filter(r -> r.stepKind() == kind).toList();
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
