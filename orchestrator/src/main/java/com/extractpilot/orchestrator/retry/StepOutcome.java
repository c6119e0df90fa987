package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.confidence.ConfidenceBreakdown;
import com.extractpilot.orchestrator.history.StepExecutionRecord;
import com.extractpilot.orchestrator.judge.JudgeVerdict;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.worker.CandidateOutput;

import java.util.List;

/**
 * How a step resolved.
 *
 * @param kind             the step
 * @param state            ACCEPTED, ESCALATED_CONTINUE or ESCALATED_STOP
 * @param reason           why retrying stopped
 * @param output           the accepted or best-effort candidate, never null
 * @param verdict          verdict on {@code output}, null if the judge call for it failed
 * @param attempts         number of worker invocations
 * @param needsHumanReview true for any non-accepted outcome or low step confidence
 * @param confidence       step-level confidence (judge and structural sources)
 * @param history          the records this step appended, in order
 */
public record StepOutcome(
        StepKind                  kind,
        StepState                 state,
        TerminationReason         reason,
        CandidateOutput           output,
        JudgeVerdict              verdict,
        int                       attempts,
        boolean                   needsHumanReview,
        ConfidenceBreakdown       confidence,
        List<StepExecutionRecord> history
) {

    public StepOutcome {
        history = history == null ? List.of() : List.copyOf(history);
    }

    public boolean accepted() {
        return state == StepState.ACCEPTED;
    }

    /** True when the pipeline must not run the remaining steps. */
    public boolean stopsPipeline() {
        return state == StepState.ESCALATED_STOP;
    }
}
