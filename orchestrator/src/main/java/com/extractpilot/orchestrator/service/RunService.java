package com.extractpilot.orchestrator.service;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.history.StepExecutionRecord;
import com.extractpilot.orchestrator.judge.JudgeVerdict;
import com.extractpilot.orchestrator.model.DocumentRun;
import com.extractpilot.orchestrator.model.RunState;
import com.extractpilot.orchestrator.model.StepAttempt;
import com.extractpilot.orchestrator.pipeline.PipelineResult;
import com.extractpilot.orchestrator.repository.DocumentRunRepository;
import com.extractpilot.orchestrator.repository.StepAttemptRepository;
import com.extractpilot.orchestrator.retry.StepOutcome;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Run lifecycle and the persisted audit trail.
 *
 * All public methods that touch the DB are @Transactional so that
 * SELECT FOR UPDATE SKIP LOCKED and the following UPDATE are atomic.
 * Attempts are inserted one by one while the run executes and are never
 * updated afterwards.
 */
@Service
public class RunService {

    private static final Logger log = LoggerFactory.getLogger(RunService.class);

    private final DocumentRunRepository  runRepo;
    private final StepAttemptRepository  attemptRepo;
    private final ObjectMapper           objectMapper;
    private final Duration               stallTimeout;

    public RunService(DocumentRunRepository runRepo,
                      StepAttemptRepository attemptRepo,
                      ObjectMapper objectMapper,
                      ExtractPilotProperties properties) {
        this.runRepo      = runRepo;
        this.attemptRepo  = attemptRepo;
        this.objectMapper = objectMapper;
        this.stallTimeout = properties.getScheduler().getStallTimeout();
    }

    // ------------------------------------------------------------------
    // Submission
    // ------------------------------------------------------------------

    /** Queue a document; the scheduler picks it up on a later tick. */
    @Transactional
    public DocumentRun submit(String documentName, String documentText) {
        DocumentRun run = runRepo.save(new DocumentRun(documentName, documentText));
        log.info("Queued run {} for document '{}' ({} chars)", run.getId(), documentName, documentText.length());
        return run;
    }

    public Optional<DocumentRun> findById(UUID id) {
        return runRepo.findById(id);
    }

    @Transactional(readOnly = true)
    public List<StepAttempt> getAttempts(UUID runId) {
        return attemptRepo.findByRunIdOrderBySequenceAsc(runId);
    }

    // ------------------------------------------------------------------
    // Claiming (called by the scheduler in a background thread)
    // ------------------------------------------------------------------

    /**
     * Claim the oldest PENDING run.
     *
     * The row lock is held from the SELECT until state = RUNNING commits,
     * so two workers never claim the same run.
     */
    @Transactional
    public Optional<DocumentRun> claimNextRun(String workerId) {
        Optional<DocumentRun> opt = runRepo.claimNextPendingRun();
        opt.ifPresent(run -> {
            Instant now = Instant.now();
            run.setState(RunState.RUNNING);
            run.setWorkerId(workerId);
            run.setStartedAt(now);
            run.setHeartbeatAt(now);
            runRepo.save(run);
            log.info("Worker '{}' claimed run {} ('{}')", workerId, run.getId(), run.getDocumentName());
        });
        return opt;
    }

    // ------------------------------------------------------------------
    // Progress (called from the run's worker thread)
    // ------------------------------------------------------------------

    /**
     * Insert one attempt of the run's history and bump the run's heartbeat.
     *
     * @param sequence position of the record in the run's history, 0-based
     */
    @Transactional
    public StepAttempt recordAttempt(UUID runId, int sequence, StepExecutionRecord record) {
        DocumentRun run = runRepo.findById(runId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown run " + runId));

        StepAttempt attempt = new StepAttempt(run, sequence, record.stepKind(), record.attempt(),
                record.startedAt(), record.finishedAt());
        JudgeVerdict verdict = record.verdict();
        if (verdict != null) {
            attempt.setScore(verdict.score());
            attempt.setDecision(verdict.decision());
            attempt.setCritique(verdict.critique());
            attempt.setIssuesJson(toJson(verdict.issues()));
            attempt.setImprovementOpsJson(toJson(verdict.improvementOps()));
            attempt.setJudgeParseFailure(verdict.parseFailure());
        }
        if (record.output() != null) {
            attempt.setOutputJson(toJson(record.output()));
        }
        attempt.setFailure(record.failure());

        run.setHeartbeatAt(Instant.now());
        runRepo.save(run);
        return attemptRepo.save(attempt);
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    /** Store the pipeline's result and move the run to its terminal state. */
    @Transactional
    public void completeRun(UUID runId, PipelineResult result) {
        DocumentRun run = runRepo.findById(runId).orElseThrow();
        run.setState(result.state());
        run.setNeedsHumanReview(result.needsHumanReview());
        run.setOverallConfidence(result.confidence() == null ? null : result.confidence().overall());
        run.setGlobalRetriesUsed(result.globalRetriesUsed());
        run.setResultJson(result.finalOutput() == null ? null : toJson(result.finalOutput().payload()));
        run.setConfidenceJson(result.confidence() == null ? null : toJson(result.confidence()));
        run.setSummaryJson(toJson(summary(result)));
        run.setFailureReason(result.failureReason());
        run.setWorkerId(null);
        run.setFinishedAt(Instant.now());
        runRepo.save(run);

        if (result.state() == RunState.FAILED) {
            log.error("Run {} FAILED: {}", runId, result.failureReason());
        } else {
            log.info("Run {} {} (confidence={}, review={})", runId, result.state(),
                    run.getOverallConfidence(), result.needsHumanReview());
        }
    }

    /** Mark a run FAILED after an unexpected error in its worker. */
    @Transactional
    public void failRun(UUID runId, String reason) {
        DocumentRun run = runRepo.findById(runId).orElseThrow();
        if (run.getState().isTerminal()) {
            log.warn("Run {} is already {}; ignoring failure '{}'", runId, run.getState(), reason);
            return;
        }
        run.setState(RunState.FAILED);
        run.setNeedsHumanReview(true);
        run.setFailureReason(reason);
        run.setWorkerId(null);
        run.setFinishedAt(Instant.now());
        runRepo.save(run);
        log.error("Run {} FAILED: {}", runId, reason);
    }

    /**
     * Fail runs whose worker has not recorded an attempt within the stall
     * timeout. A run is not resumed: its attempts so far stay in the audit
     * trail and the document can be resubmitted.
     */
    @Transactional
    public int recoverStalledRuns() {
        Instant cutoff = Instant.now().minus(stallTimeout);
        List<DocumentRun> stalled = runRepo.findByStateAndHeartbeatAtBefore(RunState.RUNNING, cutoff);
        for (DocumentRun run : stalled) {
            log.warn("Recovering stalled run {} (worker={}, last heartbeat={})",
                    run.getId(), run.getWorkerId(), run.getHeartbeatAt());
            failRun(run.getId(), "Worker heartbeat timed out after " + stallTimeout.toMinutes() + " minutes");
        }
        return stalled.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /** Per-step attempt counts, final scores and terminal states. */
    ObjectNode summary(PipelineResult result) {
        ObjectNode summary = objectMapper.createObjectNode();
        summary.put("state", result.state().name());
        summary.put("needs_human_review", result.needsHumanReview());
        summary.put("global_retries_used", result.globalRetriesUsed());
        ArrayNode steps = summary.putArray("steps");
        for (StepOutcome outcome : result.steps()) {
            ObjectNode step = steps.addObject();
            step.put("step", outcome.kind().key());
            step.put("state", outcome.state().name());
            step.put("reason", outcome.reason().name());
            step.put("attempts", outcome.attempts());
            if (outcome.verdict() != null) {
                step.put("last_score", outcome.verdict().score());
            } else {
                step.putNull("last_score");
            }
            if (outcome.confidence() != null) {
                step.put("confidence", outcome.confidence().overall());
            } else {
                step.putNull("confidence");
            }
            step.put("needs_human_review", outcome.needsHumanReview());
        }
        return summary;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise " + value.getClass().getSimpleName(), e);
        }
    }
}
