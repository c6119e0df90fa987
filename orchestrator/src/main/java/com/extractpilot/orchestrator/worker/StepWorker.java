package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.model.StepKind;

/**
 * The non-deterministic worker behind one step-kind.
 *
 * The retry controller depends only on this interface. How an
 * implementation extracts (which model, which prompt) is its own business;
 * it only has to return a candidate or fail.
 */
public interface StepWorker {

    /** The step this worker serves. */
    StepKind kind();

    /**
     * Produce a candidate output for one attempt.
     *
     * @throws WorkerException (or any RuntimeException) when no candidate could be produced
     */
    CandidateOutput invoke(StepContext context);
}
