package com.extractpilot.orchestrator.service;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.history.ExecutionHistory;
import com.extractpilot.orchestrator.history.StepExecutionRecord;
import com.extractpilot.orchestrator.model.DocumentRun;
import com.extractpilot.orchestrator.model.RunState;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.pipeline.DocumentPipeline;
import com.extractpilot.orchestrator.pipeline.PipelineResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RunScheduler.execute(): the wiring between a claimed run,
 * the pipeline and the persisted audit trail.
 */
@ExtendWith(MockitoExtension.class)
class RunSchedulerTest {

    @Mock RunService       runService;
    @Mock DocumentPipeline pipeline;

    RunScheduler scheduler;

    @BeforeEach
    void setUp() {
        ExtractPilotProperties properties = new ExtractPilotProperties();
        properties.getScheduler().setWorkers(1);
        scheduler = new RunScheduler(runService, pipeline, properties);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.shutdown();
    }

    @Test
    void execute_persistsEachAttemptThenCompletes() {
        DocumentRun run = runWithId();
        StepExecutionRecord first  = record(1);
        StepExecutionRecord second = record(2);
        PipelineResult result = new PipelineResult(RunState.COMPLETED, List.of(), null, null, false, 1, null);
        when(pipeline.run(eq(run.getId()), eq("paper.pdf"), eq("Soil microbes"), any())).thenAnswer(inv -> {
            ExecutionHistory history = inv.getArgument(3);
            history.append(first);
            history.append(second);
            return result;
        });

        scheduler.execute(run);

        verify(runService).recordAttempt(run.getId(), 0, first);
        verify(runService).recordAttempt(run.getId(), 1, second);
        verify(runService).completeRun(run.getId(), result);
        verify(runService, never()).failRun(any(), anyString());
        assertThat(MDC.get("runId")).isNull();
    }

    @Test
    void execute_pipelineThrows_runFailed() {
        DocumentRun run = runWithId();
        when(pipeline.run(any(), any(), any(), any())).thenThrow(new IllegalStateException("no rubric table"));

        scheduler.execute(run);

        verify(runService).failRun(eq(run.getId()), contains("no rubric table"));
        verify(runService, never()).completeRun(any(), any());
    }

    @Test
    void tick_nothingPending_dispatchesNothing() {
        when(runService.claimNextRun(anyString())).thenReturn(Optional.empty());

        scheduler.tick();

        verifyNoInteractions(pipeline);
    }

    @Test
    void recoverStalled_delegatesToService() {
        when(runService.recoverStalledRuns()).thenReturn(2);

        scheduler.recoverStalled();

        verify(runService).recoverStalledRuns();
    }

    // ------------------------------------------------------------------
    // Test object factories
    // ------------------------------------------------------------------

    private static StepExecutionRecord record(int attempt) {
        return new StepExecutionRecord(StepKind.PARSE, attempt, null, null, "Worker failed: timeout",
                Instant.now(), Instant.now());
    }

    private DocumentRun runWithId() {
        DocumentRun run = new DocumentRun("paper.pdf", "Soil microbes");
        try {
            var f = run.getClass().getDeclaredField("id");
            f.setAccessible(true);
            f.set(run, UUID.randomUUID());
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
        return run;
    }
}
