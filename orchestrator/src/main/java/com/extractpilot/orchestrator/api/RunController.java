package com.extractpilot.orchestrator.api;

import com.extractpilot.orchestrator.api.dto.AttemptResponse;
import com.extractpilot.orchestrator.api.dto.RunResponse;
import com.extractpilot.orchestrator.api.dto.SubmitRunRequest;
import com.extractpilot.orchestrator.model.DocumentRun;
import com.extractpilot.orchestrator.service.RunService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for document runs.
 *
 * POST /runs                  submit a document for extraction
 * GET  /runs/{id}             poll the state of a run
 * GET  /runs/{id}/attempts    the run's attempt-by-attempt audit trail
 * GET  /runs/{id}/confidence  final confidence breakdown (202 while running)
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService   runService;
    private final ObjectMapper objectMapper;

    public RunController(RunService runService, ObjectMapper objectMapper) {
        this.runService   = runService;
        this.objectMapper = objectMapper;
    }

    /**
     * Submit a document.
     *
     * Example:
     *   curl -X POST http://localhost:8080/runs \
     *     -H "Content-Type: application/json" \
     *     -d '{"documentName":"soil-study.pdf","text":"..."}'
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        if (req.text() == null || req.text().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "text must not be blank");
        }
        DocumentRun run = runService.submit(req.documentName(), req.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(RunResponse.from(run));
    }

    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return RunResponse.from(find(id));
    }

    @GetMapping("/{id}/attempts")
    public List<AttemptResponse> getAttempts(@PathVariable UUID id) {
        find(id);
        return runService.getAttempts(id).stream()
                .map(a -> AttemptResponse.from(a, objectMapper))
                .toList();
    }

    /**
     * HTTP 200 with the breakdown once the run has finished,
     * HTTP 202 with the current state while it is still queued or running,
     * HTTP 404 for an unknown run or a run that crashed before producing one.
     */
    @GetMapping("/{id}/confidence")
    public ResponseEntity<JsonNode> getConfidence(@PathVariable UUID id) {
        DocumentRun run = find(id);
        if (!run.getState().isTerminal()) {
            ObjectNode pending = objectMapper.createObjectNode();
            pending.put("status", "pending");
            pending.put("runState", run.getState().name());
            return ResponseEntity.accepted().body(pending);
        }
        if (run.getConfidenceJson() == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "No confidence recorded for run " + id);
        }
        try {
            return ResponseEntity.ok(objectMapper.readTree(run.getConfidenceJson()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt confidence JSON for run " + id, e);
        }
    }

    private DocumentRun find(UUID id) {
        return runService.findById(id).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
