package com.extractpilot.orchestrator.service;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.history.ExecutionHistory;
import com.extractpilot.orchestrator.model.DocumentRun;
import com.extractpilot.orchestrator.pipeline.DocumentPipeline;
import com.extractpilot.orchestrator.pipeline.PipelineResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background scheduler that drives document runs.
 *
 * Every 2 seconds it claims one PENDING run from the DB and runs its
 * pipeline on a fixed worker pool. The DB is the queue:
 * SELECT FOR UPDATE SKIP LOCKED is the dequeue. A tick claims nothing while
 * every worker is busy, so a claimed run never waits in the pool's queue
 * without a heartbeat.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(prefix = "extractpilot.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RunScheduler {

    private static final Logger log = LoggerFactory.getLogger(RunScheduler.class);

    private final RunService       runService;
    private final DocumentPipeline pipeline;
    private final int              workerCount;
    private final ExecutorService  workers;
    private final AtomicInteger    busy = new AtomicInteger();

    public RunScheduler(RunService runService, DocumentPipeline pipeline, ExtractPilotProperties properties) {
        this.runService  = runService;
        this.pipeline    = pipeline;
        this.workerCount = Math.max(1, properties.getScheduler().getWorkers());
        this.workers     = Executors.newFixedThreadPool(workerCount);
    }

    /** Claim one PENDING run (if a worker is free) and dispatch it. */
    @Scheduled(fixedDelay = 2000)
    public void tick() {
        if (busy.get() >= workerCount) {
            return;
        }
        String workerId = "worker-" + UUID.randomUUID().toString().substring(0, 8);

        Optional<DocumentRun> claimed = runService.claimNextRun(workerId);
        claimed.ifPresent(run -> {
            busy.incrementAndGet();
            workers.submit(() -> {
                try {
                    execute(run);
                } finally {
                    busy.decrementAndGet();
                }
            });
        });
    }

    @Scheduled(fixedDelay = 60_000, initialDelay = 60_000)
    public void recoverStalled() {
        int recovered = runService.recoverStalledRuns();
        if (recovered > 0) {
            log.warn("Failed {} stalled run(s)", recovered);
        }
    }

    /**
     * Run the pipeline for one claimed run, persisting each attempt as it
     * happens. Runs on a worker thread.
     */
    void execute(DocumentRun run) {
        UUID runId = run.getId();
        MDC.put("runId", runId.toString());
        try {
            ExecutionHistory history = new ExecutionHistory();
            history.onAppend(record -> runService.recordAttempt(runId, history.size(), record));

            PipelineResult result = pipeline.run(runId, run.getDocumentName(), run.getDocumentText(), history);
            runService.completeRun(runId, result);
        } catch (Exception e) {
            log.error("Unhandled error in pipeline for run {}: {}", runId, e.getMessage(), e);
            runService.failRun(runId, "Unhandled exception: " + e.getMessage());
        } finally {
            MDC.remove("runId");
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        workers.shutdown();
        if (!workers.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("Worker pool did not stop within 30 s; {} run(s) left RUNNING", busy.get());
            workers.shutdownNow();
        }
    }
}
