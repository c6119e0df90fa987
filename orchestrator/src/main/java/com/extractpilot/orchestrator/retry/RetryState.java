package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.judge.JudgeVerdict;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.worker.CandidateOutput;

import java.util.List;

/**
 * Mutable bookkeeping for one step while it is being resolved.
 *
 * Created when the step starts and dropped when it resolves; never shared
 * between steps or runs.
 */
public class RetryState {

    private final StepKind           kind;
    private final int                maxAttempts;
    private final FeedbackMemory     feedback;
    private final StagnationDetector stagnation;

    private StepState       state = StepState.PENDING;
    private int             attemptCount;
    private Double          lastScore;
    private CandidateOutput lastCandidate;
    private JudgeVerdict    lastVerdict;     // verdict on lastCandidate, null if it was never judged
    private String          lastFailure;

    public RetryState(StepKind kind, int maxAttempts, int feedbackCapacity, int stagnationRepeats) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        this.kind        = kind;
        this.maxAttempts = maxAttempts;
        this.feedback    = new FeedbackMemory(feedbackCapacity);
        this.stagnation  = new StagnationDetector(stagnationRepeats);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public boolean hasAttemptsLeft() {
        return attemptCount < maxAttempts;
    }

    /** Start the next attempt and return its 1-based index. */
    public int beginAttempt() {
        if (!hasAttemptsLeft()) {
            throw new IllegalStateException("Attempt ceiling of " + maxAttempts + " reached for " + kind.key());
        }
        moveTo(StepState.EXECUTING);
        return ++attemptCount;
    }

    public void candidateProduced(CandidateOutput candidate) {
        moveTo(StepState.EVALUATING);
        lastCandidate = candidate;
        lastVerdict   = null;
        lastFailure   = null;
    }

    public void verdictReceived(JudgeVerdict verdict) {
        lastVerdict = verdict;
        lastScore   = verdict.score();
    }

    public void attemptFailed(String failure) {
        lastFailure = failure;
        moveTo(StepState.RETRYING);
    }

    /**
     * Store the verdict's improvement ops and feed its score to the stagnation detector.
     *
     * @return true when the score has stopped moving
     */
    public boolean absorbFeedback(JudgeVerdict verdict) {
        feedback.add(kind, verdict.improvementOps());
        return stagnation.observe(kind, verdict.score());
    }

    public void moveTo(StepState next) {
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("Illegal step transition " + state + " -> " + next + " for " + kind.key());
        }
        state = next;
    }

    // ------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------

    public StepKind        kind()          { return kind; }
    public int             maxAttempts()   { return maxAttempts; }
    public StepState       state()         { return state; }
    public int             attemptCount()  { return attemptCount; }
    public Double          lastScore()     { return lastScore; }
    public CandidateOutput lastCandidate() { return lastCandidate; }
    public JudgeVerdict    lastVerdict()   { return lastVerdict; }
    public String          lastFailure()   { return lastFailure; }
    public List<String>    feedback()      { return feedback.get(kind); }
    public int             noProgressCount() { return stagnation.repeats(kind); }
}
