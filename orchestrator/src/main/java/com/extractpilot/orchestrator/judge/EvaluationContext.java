package com.extractpilot.orchestrator.judge;

import com.extractpilot.orchestrator.model.StepKind;

/**
 * What the judge sees of one attempt.
 *
 * @param stepKind    step being judged
 * @param goal        goal description of the step
 * @param inputs      excerpt of the step's inputs (JSON text)
 * @param output      excerpt of the candidate output (JSON text)
 * @param attempt     1-based attempt index
 * @param maxAttempts attempt ceiling for this step
 */
public record EvaluationContext(
        StepKind stepKind,
        String   goal,
        String   inputs,
        String   output,
        int      attempt,
        int      maxAttempts
) {}
