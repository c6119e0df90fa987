package com.extractpilot.orchestrator.api;

import com.extractpilot.orchestrator.judge.Decision;
import com.extractpilot.orchestrator.model.DocumentRun;
import com.extractpilot.orchestrator.model.RunState;
import com.extractpilot.orchestrator.model.StepAttempt;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.service.RunService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for RunController.
 *
 * @WebMvcTest spins up only the web layer (no DB, no scheduler, no Claude).
 */
@WebMvcTest(RunController.class)
class RunControllerTest {

    @Autowired   MockMvc    mockMvc;
    @MockitoBean RunService runService;

    // ------------------------------------------------------------------
    // POST /runs
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201WithRunId() throws Exception {
        DocumentRun run = fakeRun(RunState.PENDING);
        when(runService.submit(eq("soil-study.pdf"), eq("Soil microbes of the Atacama"))).thenReturn(run);

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"documentName":"soil-study.pdf","text":"Soil microbes of the Atacama"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(run.getId().toString()))
                .andExpect(jsonPath("$.state").value("PENDING"));
    }

    @Test
    void submit_missingName_defaultsToUntitled() throws Exception {
        DocumentRun run = fakeRun(RunState.PENDING);
        when(runService.submit(eq("untitled"), any())).thenReturn(run);

        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"Soil microbes\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    void submit_blankText_returns400() throws Exception {
        mockMvc.perform(post("/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"documentName\":\"empty.pdf\",\"text\":\"   \"}"))
                .andExpect(status().isBadRequest());

        verify(runService, never()).submit(any(), any());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}
    // ------------------------------------------------------------------

    @Test
    void getRun_existingId_returns200() throws Exception {
        DocumentRun run = fakeRun(RunState.NEEDS_REVIEW);
        run.setNeedsHumanReview(true);
        run.setOverallConfidence(0.62);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("NEEDS_REVIEW"))
                .andExpect(jsonPath("$.needsHumanReview").value(true))
                .andExpect(jsonPath("$.overallConfidence").value(0.62));
    }

    @Test
    void getRun_unknownId_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(runService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}/attempts
    // ------------------------------------------------------------------

    @Test
    void getAttempts_existingRun_returnsAuditTrail() throws Exception {
        DocumentRun run = fakeRun(RunState.RUNNING);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        StepAttempt judged = new StepAttempt(run, 0, StepKind.PARSE, 1, Instant.now(), Instant.now());
        judged.setScore(0.55);
        judged.setDecision(Decision.RETRY);
        judged.setImprovementOpsJson("[\"Add the title\"]");
        judged.setOutputJson("{\"authors\": [\"A. Smith\"]}");
        StepAttempt failed = new StepAttempt(run, 1, StepKind.PARSE, 2, Instant.now(), Instant.now());
        failed.setFailure("Worker failed: timeout");
        when(runService.getAttempts(run.getId())).thenReturn(List.of(judged, failed));

        mockMvc.perform(get("/runs/{id}/attempts", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].step").value("parse"))
                .andExpect(jsonPath("$[0].decision").value("RETRY"))
                .andExpect(jsonPath("$[0].improvementOps[0]").value("Add the title"))
                .andExpect(jsonPath("$[0].output.authors[0]").value("A. Smith"))
                .andExpect(jsonPath("$[1].attempt").value(2))
                .andExpect(jsonPath("$[1].failure").value("Worker failed: timeout"));
    }

    @Test
    void getAttempts_unknownRun_returns404() throws Exception {
        UUID unknown = UUID.randomUUID();
        when(runService.findById(unknown)).thenReturn(Optional.empty());

        mockMvc.perform(get("/runs/{id}/attempts", unknown))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // GET /runs/{id}/confidence
    // ------------------------------------------------------------------

    @Test
    void getConfidence_runStillExecuting_returns202() throws Exception {
        DocumentRun run = fakeRun(RunState.RUNNING);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}/confidence", run.getId()))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("pending"))
                .andExpect(jsonPath("$.runState").value("RUNNING"));
    }

    @Test
    void getConfidence_finishedRun_returnsBreakdown() throws Exception {
        DocumentRun run = fakeRun(RunState.COMPLETED);
        run.setConfidenceJson("""
                {"components":{"judge":0.9,"structural":0.8,"validation":null},
                 "weights":{"judge":0.625,"structural":0.375},
                 "overall":0.8625,"needsHumanReview":false,"details":{}}
                """);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}/confidence", run.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overall").value(0.8625))
                .andExpect(jsonPath("$.weights.judge").value(0.625));
    }

    @Test
    void getConfidence_failedRunWithoutBreakdown_returns404() throws Exception {
        DocumentRun run = fakeRun(RunState.FAILED);
        when(runService.findById(run.getId())).thenReturn(Optional.of(run));

        mockMvc.perform(get("/runs/{id}/confidence", run.getId()))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private DocumentRun fakeRun(RunState state) {
        DocumentRun run = new DocumentRun("soil-study.pdf", "Soil microbes of the Atacama");
        run.setState(state);
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
