package com.extractpilot.orchestrator.retry;

/**
 * What a step does when the judge's score falls below revise-min.
 */
public enum EscalationPolicy {
    /** Treat ESCALATE like RETRY while the retry budget lasts. */
    RETRY,
    /** End the step flagged for review; the pipeline moves on to the next step. */
    CONTINUE,
    /** End the step flagged for review and stop the pipeline for this document. */
    STOP
}
