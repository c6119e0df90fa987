package com.extractpilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One document submitted for extraction.
 *
 * The scheduler claims a PENDING run, a worker thread drives it through
 * PARSE → RETRIEVE → GENERATE, and the final output plus the run-level
 * confidence breakdown are written back here. The per-attempt audit trail
 * lives in {@link StepAttempt}.
 *
 * DB table: document_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "document_runs")
public class DocumentRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "document_name", nullable = false)
    private String documentName;

    // Plain text of the document; layout extraction happens before submission.
    @Column(name = "document_text", nullable = false, columnDefinition = "TEXT")
    private String documentText;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunState state = RunState.PENDING;

    @Column(name = "needs_human_review", nullable = false)
    private boolean needsHumanReview = false;

    @Column(name = "worker_id")
    private String workerId;

    // Touched on every recorded attempt; the scheduler fails runs whose heartbeat goes stale.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "overall_confidence")
    private Double overallConfidence;

    // Retries (attempts beyond the first) consumed across all steps.
    @Column(name = "global_retries_used", nullable = false)
    private int globalRetriesUsed = 0;

    // Output of the last resolved step (the generated metadata when the run completes).
    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "confidence_json", columnDefinition = "TEXT")
    private String confidenceJson;

    // Per-step summary: terminal state, attempts, last score.
    @Column(name = "summary_json", columnDefinition = "TEXT")
    private String summaryJson;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected DocumentRun() {}   // required by JPA

    public DocumentRun(String documentName, String documentText) {
        this.documentName = documentName;
        this.documentText = documentText;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID     getId()                { return id; }
    public String   getDocumentName()      { return documentName; }
    public String   getDocumentText()      { return documentText; }
    public RunState getState()             { return state; }
    public boolean  isNeedsHumanReview()   { return needsHumanReview; }
    public String   getWorkerId()          { return workerId; }
    public Instant  getHeartbeatAt()       { return heartbeatAt; }
    public Double   getOverallConfidence() { return overallConfidence; }
    public int      getGlobalRetriesUsed() { return globalRetriesUsed; }
    public String   getResultJson()        { return resultJson; }
    public String   getConfidenceJson()    { return confidenceJson; }
    public String   getSummaryJson()       { return summaryJson; }
    public String   getFailureReason()     { return failureReason; }
    public Instant  getCreatedAt()         { return createdAt; }
    public Instant  getUpdatedAt()         { return updatedAt; }
    public Instant  getStartedAt()         { return startedAt; }
    public Instant  getFinishedAt()        { return finishedAt; }

    public void setState(RunState state)               { this.state = state; }
    public void setNeedsHumanReview(boolean v)         { this.needsHumanReview = v; }
    public void setWorkerId(String workerId)           { this.workerId = workerId; }
    public void setHeartbeatAt(Instant t)              { this.heartbeatAt = t; }
    public void setOverallConfidence(Double v)         { this.overallConfidence = v; }
    public void setGlobalRetriesUsed(int v)            { this.globalRetriesUsed = v; }
    public void setResultJson(String v)                { this.resultJson = v; }
    public void setConfidenceJson(String v)            { this.confidenceJson = v; }
    public void setSummaryJson(String v)               { this.summaryJson = v; }
    public void setFailureReason(String v)             { this.failureReason = v; }
    public void setStartedAt(Instant t)                { this.startedAt = t; }
    public void setFinishedAt(Instant t)               { this.finishedAt = t; }
}
