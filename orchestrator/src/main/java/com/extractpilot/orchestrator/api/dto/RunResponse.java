package com.extractpilot.orchestrator.api.dto;

import com.extractpilot.orchestrator.model.DocumentRun;

import java.time.Instant;
import java.util.UUID;

/**
 * Response body for POST /runs and GET /runs/{id}.
 */
public record RunResponse(
        UUID    id,
        String  documentName,
        String  state,
        boolean needsHumanReview,
        Double  overallConfidence,
        int     globalRetriesUsed,
        String  failureReason,
        Instant createdAt,
        Instant startedAt,
        Instant finishedAt
) {
    public static RunResponse from(DocumentRun run) {
        return new RunResponse(
                run.getId(),
                run.getDocumentName(),
                run.getState().name(),
                run.isNeedsHumanReview(),
                run.getOverallConfidence(),
                run.getGlobalRetriesUsed(),
                run.getFailureReason(),
                run.getCreatedAt(),
                run.getStartedAt(),
                run.getFinishedAt()
        );
    }
}
