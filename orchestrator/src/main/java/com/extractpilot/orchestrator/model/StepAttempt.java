package com.extractpilot.orchestrator.model;

import com.extractpilot.orchestrator.judge.Decision;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted form of one step attempt: what the worker produced and how the
 * judge scored it.
 *
 * Rows are inserted once and never updated; every column is
 * {@code updatable = false} so the audit trail cannot be rewritten.
 *
 * DB table: step_attempts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "step_attempts")
public class StepAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "run_id", nullable = false, updatable = false)
    private DocumentRun run;

    // Position in the run's execution history (0-based).
    @Column(nullable = false, updatable = false)
    private int sequence;

    @Enumerated(EnumType.STRING)
    @Column(name = "step_kind", nullable = false, updatable = false)
    private StepKind stepKind;

    @Column(nullable = false, updatable = false)
    private int attempt;

    // Null when the attempt failed before the judge returned.
    @Column(updatable = false)
    private Double score;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false)
    private Decision decision;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String critique;

    @Column(name = "issues_json", columnDefinition = "TEXT", updatable = false)
    private String issuesJson;

    @Column(name = "improvement_ops_json", columnDefinition = "TEXT", updatable = false)
    private String improvementOpsJson;

    @Column(name = "judge_parse_failure", nullable = false, updatable = false)
    private boolean judgeParseFailure;

    @Column(name = "output_json", columnDefinition = "TEXT", updatable = false)
    private String outputJson;

    // Failure marker: set when the worker or judge invocation raised.
    @Column(columnDefinition = "TEXT", updatable = false)
    private String failure;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;

    protected StepAttempt() {}   // required by JPA

    public StepAttempt(DocumentRun run, int sequence, StepKind stepKind, int attempt,
                       Instant startedAt, Instant finishedAt) {
        this.run        = run;
        this.sequence   = sequence;
        this.stepKind   = stepKind;
        this.attempt    = attempt;
        this.startedAt  = startedAt;
        this.finishedAt = finishedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters (setters are only used before the insert)
    // ------------------------------------------------------------------

    public UUID        getId()                 { return id; }
    public DocumentRun getRun()                { return run; }
    public int         getSequence()           { return sequence; }
    public StepKind    getStepKind()           { return stepKind; }
    public int         getAttempt()            { return attempt; }
    public Double      getScore()              { return score; }
    public Decision    getDecision()           { return decision; }
    public String      getCritique()           { return critique; }
    public String      getIssuesJson()         { return issuesJson; }
    public String      getImprovementOpsJson() { return improvementOpsJson; }
    public boolean     isJudgeParseFailure()   { return judgeParseFailure; }
    public String      getOutputJson()         { return outputJson; }
    public String      getFailure()            { return failure; }
    public Instant     getStartedAt()          { return startedAt; }
    public Instant     getFinishedAt()         { return finishedAt; }

    public void setScore(Double score)                 { this.score = score; }
    public void setDecision(Decision decision)         { this.decision = decision; }
    public void setCritique(String critique)           { this.critique = critique; }
    public void setIssuesJson(String v)                { this.issuesJson = v; }
    public void setImprovementOpsJson(String v)        { this.improvementOpsJson = v; }
    public void setJudgeParseFailure(boolean v)        { this.judgeParseFailure = v; }
    public void setOutputJson(String v)                { this.outputJson = v; }
    public void setFailure(String failure)             { this.failure = failure; }
}
