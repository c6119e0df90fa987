package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.claude.ClaudeClient;
import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * PARSE: raw document text to structured document info.
 */
@Component
public class DocumentParserWorker extends PromptedStepWorker {

    public DocumentParserWorker(ClaudeClient claude, ExtractPilotProperties properties) {
        super(claude, properties.getClaude().getWorkerModel());
    }

    @Override
    public StepKind kind() {
        return StepKind.PARSE;
    }

    @Override
    protected String systemPrompt() {
        return """
                You extract structured information from research documents.
                Identify what kind of document it is and which domain it belongs to,
                then extract everything that is actually present. Use descriptive
                field names (sampling_location, not location) and group related
                values into nested objects. Never invent values the text does not state.
                """;
    }

    @Override
    protected String task(StepContext context) {
        return """
                Extract the document information from "document_text".
                Always include, when present: title, authors, research_domain,
                objectives, methodology, data_and_samples, key_findings.
                Add a "field_confidence" object mapping each top-level field you
                extracted to your confidence in it, between 0.0 and 1.0.
                """;
    }

    @Override
    protected void validate(ObjectNode output) {
        require(kind(), output, "title");
    }
}
