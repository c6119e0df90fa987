package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.confidence.ConfidenceAggregator;
import com.extractpilot.orchestrator.confidence.ConfidenceBreakdown;
import com.extractpilot.orchestrator.confidence.StructuralMetrics;
import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.history.ExecutionHistory;
import com.extractpilot.orchestrator.history.StepExecutionRecord;
import com.extractpilot.orchestrator.judge.Decision;
import com.extractpilot.orchestrator.judge.DecisionThresholds;
import com.extractpilot.orchestrator.judge.EvaluationContext;
import com.extractpilot.orchestrator.judge.JudgeVerdict;
import com.extractpilot.orchestrator.judge.RubricEvaluator;
import com.extractpilot.orchestrator.judge.RubricRegistry;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.worker.CandidateOutput;
import com.extractpilot.orchestrator.worker.StepContext;
import com.extractpilot.orchestrator.worker.StepWorker;
import com.extractpilot.orchestrator.worker.WorkerException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves one step: invoke the worker, judge the candidate, and decide
 * whether to accept, retry or give up.
 *
 * <p>Signals are applied in this order of precedence:
 * <ol>
 *   <li>the caller's attempt ceiling, never exceeded;</li>
 *   <li>stagnation: an unchanged score ends the step early, flagged;</li>
 *   <li>the decision re-derived from the judge's score and the step's
 *       escalation policy;</li>
 *   <li>once attempts run out, the last candidate is returned flagged.</li>
 * </ol>
 *
 * A worker exception, a null output or a failed judge call is recorded as a
 * failed attempt and uses up one attempt like a low score would. Failed
 * attempts never reach the stagnation detector. Only a step that never
 * produced a candidate throws {@link StepFailedException}.
 *
 * The controller itself is stateless; each call works on a fresh
 * {@link RetryState}, so concurrent runs can share the bean.
 */
@Component
public class RetryController {

    private static final Logger log = LoggerFactory.getLogger(RetryController.class);

    private final RubricEvaluator      evaluator;
    private final RubricRegistry       rubrics;
    private final ConfidenceAggregator aggregator;
    private final StructuralMetrics    structuralMetrics;
    private final MeterRegistry        meterRegistry;
    private final int                  feedbackCapacity;
    private final int                  stagnationRepeats;

    public RetryController(RubricEvaluator evaluator,
                           RubricRegistry rubrics,
                           ConfidenceAggregator aggregator,
                           StructuralMetrics structuralMetrics,
                           ExtractPilotProperties properties,
                           MeterRegistry meterRegistry) {
        this.evaluator         = evaluator;
        this.rubrics           = rubrics;
        this.aggregator        = aggregator;
        this.structuralMetrics = structuralMetrics;
        this.meterRegistry     = meterRegistry;
        this.feedbackCapacity  = properties.getRetry().getFeedbackCapacity();
        this.stagnationRepeats = properties.getRetry().getStagnationRepeats();
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    /**
     * Run attempts of one step until it resolves.
     *
     * @param kind        the step
     * @param worker      produces one candidate per call
     * @param context     base context; attempt, feedback and previous output are filled in per attempt
     * @param maxAttempts hard ceiling on worker invocations, at least 1
     * @param history     the run's history; one record is appended per attempt
     * @throws StepFailedException when no attempt produced a candidate
     */
    public StepOutcome resolveStep(StepKind kind,
                                   StepWorker worker,
                                   StepContext context,
                                   int maxAttempts,
                                   ExecutionHistory history) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, was " + maxAttempts);
        }
        DecisionThresholds thresholds = rubrics.thresholdsFor(kind);
        EscalationPolicy   escalation = rubrics.escalationFor(kind);
        RetryState state = new RetryState(kind, maxAttempts, feedbackCapacity, stagnationRepeats);
        int historyStart = history.size();

        MDC.put("stepKind", kind.key());
        try {
            log.info("Resolving step '{}' (max attempts {}, escalation {})", kind.key(), maxAttempts, escalation);

            while (state.hasAttemptsLeft()) {
                int attempt = state.beginAttempt();
                MDC.put("attempt", String.valueOf(attempt));
                Instant startedAt = Instant.now();

                // --- Worker ---
                CandidateOutput candidate;
                try {
                    candidate = worker.invoke(context.forAttempt(
                            attempt, maxAttempts, state.feedback(), state.lastCandidate()));
                    if (candidate == null) {
                        throw new WorkerException(kind, "Worker returned no output");
                    }
                } catch (RuntimeException e) {
                    String failure = failureMarker("Worker failed", e);
                    log.warn("Attempt {}/{} of step '{}' failed: {}", attempt, maxAttempts, kind.key(), failure);
                    history.append(new StepExecutionRecord(kind, attempt, null, null, failure, startedAt, Instant.now()));
                    state.attemptFailed(failure);
                    continue;
                }
                state.candidateProduced(candidate);

                // --- Judge ---
                JudgeVerdict verdict;
                try {
                    EvaluationContext evaluation = new EvaluationContext(
                            kind, context.goal(), context.inputsJson(), candidate.payloadText(),
                            attempt, maxAttempts);
                    verdict = evaluator.evaluate(evaluation, state.feedback()).rederive(thresholds);
                } catch (RuntimeException e) {
                    String failure = failureMarker("Judge failed", e);
                    log.warn("Judging attempt {}/{} of step '{}' failed: {}", attempt, maxAttempts, kind.key(), failure);
                    history.append(new StepExecutionRecord(
                            kind, attempt, candidate.payload(), null, failure, startedAt, Instant.now()));
                    state.attemptFailed(failure);
                    continue;
                }
                state.verdictReceived(verdict);
                history.append(new StepExecutionRecord(
                        kind, attempt, candidate.payload(), verdict, null, startedAt, Instant.now()));

                // --- Decide ---
                if (verdict.decision() == Decision.ACCEPT) {
                    return finish(state, StepState.ACCEPTED, TerminationReason.ACCEPTED, false, history, historyStart);
                }
                if (verdict.decision() == Decision.ESCALATE && escalation != EscalationPolicy.RETRY) {
                    StepState terminal = escalation == EscalationPolicy.STOP
                            ? StepState.ESCALATED_STOP
                            : StepState.ESCALATED_CONTINUE;
                    return finish(state, terminal, TerminationReason.ESCALATED, true, history, historyStart);
                }
                if (state.absorbFeedback(verdict)) {
                    log.warn("Step '{}' made no progress: score {} repeated {} time(s)",
                            kind.key(), verdict.score(), state.noProgressCount());
                    return finish(state, StepState.ESCALATED_CONTINUE, TerminationReason.STAGNATED,
                            true, history, historyStart);
                }
                if (!state.hasAttemptsLeft()) {
                    break;
                }
                state.moveTo(StepState.RETRYING);
                log.info("Retrying step '{}': score {} -> {} ({} improvement op(s) carried forward)",
                        kind.key(), verdict.score(), verdict.decision(), state.feedback().size());
            }

            if (state.lastCandidate() != null) {
                log.warn("Step '{}' used all {} attempts without acceptance; keeping last candidate",
                        kind.key(), maxAttempts);
                return finish(state, StepState.ESCALATED_CONTINUE, TerminationReason.RETRIES_EXHAUSTED,
                        true, history, historyStart);
            }

            meterRegistry.counter("extractpilot.step.resolutions", "step", kind.key(), "state", "FAILED").increment();
            log.error("Step '{}' produced no output in {} attempt(s)", kind.key(), state.attemptCount());
            throw new StepFailedException(kind, state.attemptCount(), state.lastFailure(), history.since(historyStart));
        } finally {
            MDC.remove("attempt");
            MDC.remove("stepKind");
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private StepOutcome finish(RetryState state,
                               StepState terminal,
                               TerminationReason reason,
                               boolean flagged,
                               ExecutionHistory history,
                               int historyStart) {
        state.moveTo(terminal);
        ConfidenceBreakdown confidence = stepConfidence(state);
        boolean review = flagged || confidence.needsHumanReview();

        meterRegistry.counter("extractpilot.step.resolutions",
                "step", state.kind().key(), "state", terminal.name()).increment();
        log.info("Step '{}' resolved {} ({}) after {} attempt(s); confidence={} review={}",
                state.kind().key(), terminal, reason, state.attemptCount(),
                "%.3f".formatted(confidence.overall()), review);

        return new StepOutcome(state.kind(), terminal, reason, state.lastCandidate(), state.lastVerdict(),
                state.attemptCount(), review, confidence, history.since(historyStart));
    }

    private ConfidenceBreakdown stepConfidence(RetryState state) {
        StructuralMetrics.Measurement structural = structuralMetrics.measure(state.lastCandidate());
        Map<String, Double> sources = new LinkedHashMap<>();
        sources.put(ConfidenceAggregator.JUDGE,
                state.lastVerdict() == null ? null : state.lastVerdict().score());
        sources.put(ConfidenceAggregator.STRUCTURAL, structural.score());
        return aggregator.breakdown(sources).withDetails(structural.details());
    }

    private static String failureMarker(String prefix, RuntimeException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return prefix + ": " + message;
    }
}
