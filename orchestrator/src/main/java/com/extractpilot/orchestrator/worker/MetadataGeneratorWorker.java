package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.claude.ClaudeClient;
import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * GENERATE: document info plus retrieved fields to filled-in metadata,
 * one entry per field with value, evidence and confidence.
 */
@Component
public class MetadataGeneratorWorker extends PromptedStepWorker {

    public MetadataGeneratorWorker(ClaudeClient claude, ExtractPilotProperties properties) {
        super(claude, properties.getClaude().getWorkerModel());
    }

    @Override
    public StepKind kind() {
        return StepKind.GENERATE;
    }

    @Override
    protected String systemPrompt() {
        return """
                You fill in research metadata from extracted document information.
                Every value must be supported by the document; cite where it came from.
                Leave a value empty rather than guessing.
                """;
    }

    @Override
    protected String task(StepContext context) {
        return """
                For every field in "retrieved_knowledge.fields", produce a value from
                "document_info". Return {"fields": [{"field_name": "...", "value": "...",
                "evidence": "where in the document the value comes from",
                "confidence": 0.0}]} with exactly one entry per field, using the exact
                field_name given. confidence is between 0.0 and 1.0.
                """;
    }

    @Override
    protected void validate(ObjectNode output) {
        JsonNode fields = output.get("fields");
        if (fields == null || !fields.isArray()) {
            throw new WorkerException(kind(), "Output has no \"fields\" array");
        }
    }
}
