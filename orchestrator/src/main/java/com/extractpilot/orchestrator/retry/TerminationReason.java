package com.extractpilot.orchestrator.retry;

/**
 * Why a step stopped retrying.
 */
public enum TerminationReason {
    /** The judge accepted the last candidate. */
    ACCEPTED,
    /** The judge escalated and the step's policy ends the step. */
    ESCALATED,
    /** Consecutive attempts produced the same score. */
    STAGNATED,
    /** The attempt ceiling was reached; the last candidate is returned flagged. */
    RETRIES_EXHAUSTED
}
