package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.history.StepExecutionRecord;
import com.extractpilot.orchestrator.model.StepKind;

import java.util.List;

/**
 * A step used up its attempts without a single candidate output.
 *
 * The only failure that leaves the retry controller. The pipeline turns it
 * into a FAILED run and skips the remaining steps.
 */
public class StepFailedException extends RuntimeException {

    private final StepKind                  stepKind;
    private final int                       attempts;
    private final List<StepExecutionRecord> history;

    public StepFailedException(StepKind stepKind, int attempts, String lastFailure,
                               List<StepExecutionRecord> history) {
        super("Step '%s' produced no usable output after %d attempt(s); last failure: %s"
                .formatted(stepKind.key(), attempts, lastFailure));
        this.stepKind = stepKind;
        this.attempts = attempts;
        this.history  = List.copyOf(history);
    }

    public StepKind                  getStepKind() { return stepKind; }
    public int                       getAttempts() { return attempts; }
    public List<StepExecutionRecord> getHistory()  { return history; }
}
