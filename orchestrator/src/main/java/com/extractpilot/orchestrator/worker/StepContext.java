package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a worker receives for one attempt.
 *
 * The orchestrator builds the base context per step (inputs threaded from
 * earlier steps); the retry controller derives one copy per attempt with
 * the attempt index, the accumulated feedback and the previous candidate.
 *
 * @param runId          owning document run
 * @param stepKind       step being executed
 * @param goal           goal description from configuration
 * @param inputs         named inputs, e.g. "document_text", "document_info"
 * @param attempt        1-based attempt index (0 before the first attempt)
 * @param maxAttempts    attempt ceiling for this step
 * @param feedback       improvement ops from earlier attempts, oldest first
 * @param previousOutput the last candidate, or null on the first attempt
 */
public record StepContext(
        UUID                  runId,
        StepKind              stepKind,
        String                goal,
        Map<String, JsonNode> inputs,
        int                   attempt,
        int                   maxAttempts,
        List<String>          feedback,
        CandidateOutput       previousOutput
) {

    public StepContext {
        goal     = goal == null ? "" : goal;
        inputs   = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }

    /** Base context for a step, before any attempt has run. */
    public static StepContext initial(UUID runId, StepKind kind, String goal, Map<String, JsonNode> inputs) {
        return new StepContext(runId, kind, goal, inputs, 0, 0, List.of(), null);
    }

    public StepContext forAttempt(int attempt, int maxAttempts, List<String> feedback, CandidateOutput previous) {
        return new StepContext(runId, stepKind, goal, inputs, attempt, maxAttempts, feedback, previous);
    }

    public boolean isRetry() {
        return attempt > 1;
    }

    /** Inputs rendered as one pretty-printed JSON object. */
    public String inputsJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        inputs.forEach(node::set);
        return node.toPrettyString();
    }
}
