package com.extractpilot.orchestrator.pipeline;

import com.extractpilot.orchestrator.confidence.ConfidenceAggregator;
import com.extractpilot.orchestrator.confidence.ConfidenceBreakdown;
import com.extractpilot.orchestrator.confidence.StructuralMetrics;
import com.extractpilot.orchestrator.confidence.ValidationReport;
import com.extractpilot.orchestrator.confidence.ValidationSignal;
import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.config.ExtractPilotProperties.StepSettings;
import com.extractpilot.orchestrator.history.ExecutionHistory;
import com.extractpilot.orchestrator.history.StepExecutionRecord;
import com.extractpilot.orchestrator.model.RunState;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.retry.RetryController;
import com.extractpilot.orchestrator.retry.StepFailedException;
import com.extractpilot.orchestrator.retry.StepOutcome;
import com.extractpilot.orchestrator.worker.CandidateOutput;
import com.extractpilot.orchestrator.worker.StepContext;
import com.extractpilot.orchestrator.worker.WorkerRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs PARSE, RETRIEVE and GENERATE for one document.
 *
 * Each step's output is handed to the following steps under
 * {@link StepKind#outputKey()}. A step may use at most its own attempt
 * limit, and never more than one attempt plus what is left of the run's
 * global retry budget. The pipeline stops early when a step fails outright
 * (run FAILED) or escalates with the STOP policy (run NEEDS_REVIEW).
 *
 * The bean holds no per-run state: the caller owns the
 * {@link ExecutionHistory} and every step gets a fresh retry state.
 */
@Component
public class DocumentPipeline {

    private static final Logger log = LoggerFactory.getLogger(DocumentPipeline.class);

    private final RetryController        retryController;
    private final WorkerRegistry         workers;
    private final ConfidenceAggregator   aggregator;
    private final StructuralMetrics      structuralMetrics;
    private final List<ValidationSignal> validators;
    private final ExtractPilotProperties properties;

    public DocumentPipeline(RetryController retryController,
                            WorkerRegistry workers,
                            ConfidenceAggregator aggregator,
                            StructuralMetrics structuralMetrics,
                            List<ValidationSignal> validators,
                            ExtractPilotProperties properties) {
        this.retryController   = retryController;
        this.workers           = workers;
        this.aggregator        = aggregator;
        this.structuralMetrics = structuralMetrics;
        this.validators        = List.copyOf(validators);
        this.properties        = properties;
    }

    // ------------------------------------------------------------------
    // Entry point
    // ------------------------------------------------------------------

    public PipelineResult run(UUID runId, String documentName, String documentText, ExecutionHistory history) {
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        inputs.put("document_name", TextNode.valueOf(documentName == null ? "" : documentName));
        inputs.put("document_text", TextNode.valueOf(documentText == null ? "" : documentText));

        int globalBudget = Math.max(0, properties.getRetry().getMaxGlobalRetries());
        int retriesUsed  = 0;
        List<StepOutcome> outcomes = new ArrayList<>();
        boolean stopped = false;

        for (StepKind kind : StepKind.PIPELINE) {
            int ceiling = Math.min(maxAttemptsFor(kind), 1 + Math.max(0, globalBudget - retriesUsed));
            StepContext context = StepContext.initial(runId, kind, goalFor(kind), inputs);

            StepOutcome outcome;
            try {
                outcome = retryController.resolveStep(kind, workers.instrumented(kind), context, ceiling, history);
            } catch (StepFailedException e) {
                retriesUsed += Math.max(0, e.getAttempts() - 1);
                log.error("Run {} failed at step '{}': {}", runId, kind.key(), e.getMessage());
                ConfidenceBreakdown confidence = runConfidence(history, lastOutput(outcomes));
                return new PipelineResult(RunState.FAILED, outcomes, lastOutput(outcomes), confidence,
                        true, retriesUsed, e.getMessage());
            }

            retriesUsed += outcome.attempts() - 1;
            outcomes.add(outcome);
            inputs.put(kind.outputKey(), outcome.output().payload());

            if (outcome.stopsPipeline()) {
                log.warn("Run {} stopped after step '{}' escalated; remaining steps skipped", runId, kind.key());
                stopped = true;
                break;
            }
        }

        CandidateOutput finalOutput = lastOutput(outcomes);
        ConfidenceBreakdown confidence = runConfidence(history, finalOutput);
        boolean review = stopped
                || confidence.needsHumanReview()
                || outcomes.stream().anyMatch(StepOutcome::needsHumanReview);
        RunState state = review ? RunState.NEEDS_REVIEW : RunState.COMPLETED;

        log.info("Run {} finished {}: confidence={} retries used={}/{}",
                runId, state, "%.3f".formatted(confidence.overall()), retriesUsed, globalBudget);
        return new PipelineResult(state, outcomes, finalOutput, confidence, review, retriesUsed, null);
    }

    // ------------------------------------------------------------------
    // Run-level confidence
    // ------------------------------------------------------------------

    /**
     * Judge: mean score over every judged attempt of the run.
     * Structural: metrics of the final output.
     * Validation: registered checkers on the final output, left out when there are none.
     */
    ConfidenceBreakdown runConfidence(ExecutionHistory history, CandidateOutput finalOutput) {
        List<Double> judgeScores = history.records().stream()
                .filter(r -> r.verdict() != null)
                .map(StepExecutionRecord::score)
                .toList();
        Double judge = judgeScores.isEmpty()
                ? null
                : judgeScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);

        StructuralMetrics.Measurement structural = structuralMetrics.measure(finalOutput);

        ValidationReport report = null;
        if (!validators.isEmpty() && finalOutput != null) {
            report = ValidationReport.clean();
            for (ValidationSignal validator : validators) {
                report = report.merge(validator.validate(finalOutput));
            }
        }
        double passTarget = properties.getConfidence().getValidationPassTarget();

        Map<String, Double> sources = new LinkedHashMap<>();
        sources.put(ConfidenceAggregator.JUDGE,      judge);
        sources.put(ConfidenceAggregator.STRUCTURAL, structural.score());
        sources.put(ConfidenceAggregator.VALIDATION, report == null ? null : report.score(passTarget));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("judge_scores", judgeScores);
        details.putAll(structural.details());
        details.put("validation_errors",   report == null ? null : report.errors());
        details.put("validation_warnings", report == null ? null : report.warnings());

        return aggregator.breakdown(sources).withDetails(details);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    int maxAttemptsFor(StepKind kind) {
        StepSettings settings = properties.getSteps().get(kind.key());
        Integer perStep = settings == null ? null : settings.getMaxRetries();
        int max = perStep != null ? perStep : properties.getRetry().getMaxStepRetries();
        if (max < 1) {
            throw new IllegalStateException("max-retries for step '" + kind.key() + "' must be >= 1, was " + max);
        }
        return max;
    }

    private String goalFor(StepKind kind) {
        StepSettings settings = properties.getSteps().get(kind.key());
        return settings == null || settings.getGoal() == null ? "" : settings.getGoal();
    }

    private static CandidateOutput lastOutput(List<StepOutcome> outcomes) {
        return outcomes.isEmpty() ? null : outcomes.get(outcomes.size() - 1).output();
    }
}
