package com.extractpilot.orchestrator.retry;

/**
 * Lifecycle of one step inside the retry controller.
 *
 * <pre>
 *   PENDING -> EXECUTING -> EVALUATING -> ACCEPTED | RETRYING | ESCALATED_CONTINUE | ESCALATED_STOP
 *   RETRYING -> EXECUTING | ESCALATED_CONTINUE
 * </pre>
 */
public enum StepState {
    PENDING,
    EXECUTING,
    EVALUATING,
    RETRYING,
    ACCEPTED,
    ESCALATED_CONTINUE,
    ESCALATED_STOP;

    public boolean isTerminal() {
        return this == ACCEPTED || this == ESCALATED_CONTINUE || this == ESCALATED_STOP;
    }

    /** Whether {@code next} is a legal successor of this state. */
    public boolean canMoveTo(StepState next) {
        return switch (this) {
            case PENDING -> next == EXECUTING;
            // RETRYING with no attempts left ends the step on its last usable candidate
            case RETRYING -> next == EXECUTING || next == ESCALATED_CONTINUE;
            // a failed invocation goes straight back to RETRYING without evaluation
            case EXECUTING -> next == EVALUATING || next == RETRYING;
            case EVALUATING -> next == RETRYING || next.isTerminal();
            case ACCEPTED, ESCALATED_CONTINUE, ESCALATED_STOP -> false;
        };
    }
}
