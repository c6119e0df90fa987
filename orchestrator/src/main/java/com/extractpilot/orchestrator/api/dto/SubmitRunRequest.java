package com.extractpilot.orchestrator.api.dto;

/**
 * Request body for POST /runs.
 *
 * Required: text (the document's extracted text).
 * Optional: documentName, defaults to "untitled".
 */
public record SubmitRunRequest(String documentName, String text) {

    public SubmitRunRequest {
        if (documentName == null || documentName.isBlank()) documentName = "untitled";
    }
}
