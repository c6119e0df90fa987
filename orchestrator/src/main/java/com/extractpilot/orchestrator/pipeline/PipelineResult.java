package com.extractpilot.orchestrator.pipeline;

import com.extractpilot.orchestrator.confidence.ConfidenceBreakdown;
import com.extractpilot.orchestrator.model.RunState;
import com.extractpilot.orchestrator.retry.StepOutcome;
import com.extractpilot.orchestrator.worker.CandidateOutput;

import java.util.List;

/**
 * What one pipeline run produced.
 *
 * @param state             COMPLETED, NEEDS_REVIEW or FAILED
 * @param steps             outcomes of the steps that resolved, in order
 * @param finalOutput       output of the last resolved step, null if none resolved
 * @param confidence        run-level confidence
 * @param needsHumanReview  any step flagged, low run confidence, or the pipeline stopped early
 * @param globalRetriesUsed retries (attempts beyond the first) spent across all steps
 * @param failureReason     set only when {@code state} is FAILED
 */
public record PipelineResult(
        RunState            state,
        List<StepOutcome>   steps,
        CandidateOutput     finalOutput,
        ConfidenceBreakdown confidence,
        boolean             needsHumanReview,
        int                 globalRetriesUsed,
        String              failureReason
) {

    public PipelineResult {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
