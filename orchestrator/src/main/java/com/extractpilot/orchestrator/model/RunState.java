package com.extractpilot.orchestrator.model;

/**
 * Lifecycle of one document run.
 *
 * Transitions:
 *   PENDING → RUNNING       (claimed by a scheduler worker)
 *   RUNNING → COMPLETED     (every step resolved, confidence above threshold)
 *   RUNNING → NEEDS_REVIEW  (finished, but a step was flagged or confidence is low)
 *   RUNNING → FAILED        (a step produced no usable output, or the worker crashed)
 */
public enum RunState {
    PENDING,
    RUNNING,
    COMPLETED,
    NEEDS_REVIEW,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == NEEDS_REVIEW || this == FAILED;
    }
}
