package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.claude.ClaudeClient;
import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

/**
 * RETRIEVE: document info to the metadata packages and terms worth filling.
 */
@Component
public class KnowledgeRetrieverWorker extends PromptedStepWorker {

    public KnowledgeRetrieverWorker(ClaudeClient claude, ExtractPilotProperties properties) {
        super(claude, properties.getClaude().getWorkerModel());
    }

    @Override
    public StepKind kind() {
        return StepKind.RETRIEVE;
    }

    @Override
    protected String systemPrompt() {
        return """
                You are a research data curator. Given structured information about a
                document, you choose the metadata packages and vocabulary terms that
                describe its data, across investigation, study, assay, sample and
                observation levels.
                """;
    }

    @Override
    protected String task(StepContext context) {
        return """
                Using "document_info", select the metadata packages and fields that apply.
                Return {"packages": ["..."], "fields": [{"field_name": "...", "package": "...",
                "level": "investigation|study|assay|sample|observation", "reason": "..."}]}.
                Select between 10 and 30 fields and cover at least three levels.
                """;
    }

    @Override
    protected void validate(ObjectNode output) {
        JsonNode fields = output.get("fields");
        if (fields == null || !fields.isArray() || fields.isEmpty()) {
            throw new WorkerException(kind(), "Output has no selected fields");
        }
    }
}
