package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.model.StepKind;

/**
 * A worker invocation produced no candidate output.
 *
 * Unchecked: the retry controller catches it (like any other runtime
 * failure of a worker) and records a failed attempt.
 */
public class WorkerException extends RuntimeException {

    private final StepKind stepKind;

    public WorkerException(StepKind stepKind, String message) {
        super("[" + stepKind.key() + "] " + message);
        this.stepKind = stepKind;
    }

    public WorkerException(StepKind stepKind, String message, Throwable cause) {
        super("[" + stepKind.key() + "] " + message, cause);
        this.stepKind = stepKind;
    }

    public StepKind getStepKind() { return stepKind; }
}
