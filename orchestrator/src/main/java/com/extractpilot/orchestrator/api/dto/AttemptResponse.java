package com.extractpilot.orchestrator.api.dto;

import com.extractpilot.orchestrator.judge.Decision;
import com.extractpilot.orchestrator.model.StepAttempt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.List;

/**
 * One entry of the audit trail returned by GET /runs/{id}/attempts.
 *
 * score and decision are null for attempts that never got a verdict;
 * failure is set for attempts whose worker or judge call failed.
 */
public record AttemptResponse(
        int          sequence,
        String       step,
        int          attempt,
        Double       score,
        Decision     decision,
        String       critique,
        List<String> issues,
        List<String> improvementOps,
        boolean      judgeParseFailure,
        String       failure,
        JsonNode     output,
        Instant      startedAt,
        Instant      finishedAt
) {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    public static AttemptResponse from(StepAttempt a, ObjectMapper objectMapper) {
        try {
            return new AttemptResponse(
                    a.getSequence(),
                    a.getStepKind().key(),
                    a.getAttempt(),
                    a.getScore(),
                    a.getDecision(),
                    a.getCritique(),
                    a.getIssuesJson() == null ? List.of() : objectMapper.readValue(a.getIssuesJson(), STRING_LIST),
                    a.getImprovementOpsJson() == null
                            ? List.of()
                            : objectMapper.readValue(a.getImprovementOpsJson(), STRING_LIST),
                    a.isJudgeParseFailure(),
                    a.getFailure(),
                    a.getOutputJson() == null ? null : objectMapper.readTree(a.getOutputJson()),
                    a.getStartedAt(),
                    a.getFinishedAt()
            );
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt JSON in attempt " + a.getId(), e);
        }
    }
}
