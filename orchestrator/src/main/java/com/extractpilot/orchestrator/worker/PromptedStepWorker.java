package com.extractpilot.orchestrator.worker;

import com.extractpilot.orchestrator.claude.ClaudeClient;
import com.extractpilot.orchestrator.claude.ClaudeClient.Message;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.parse.ResponseParser;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * A worker that asks Claude for one JSON object per attempt.
 *
 * Subclasses supply the system prompt and the task description; this class
 * adds the inputs, the previous candidate and the improvement feedback on
 * retries, then recovers the JSON with {@link ResponseParser}.
 */
public abstract class PromptedStepWorker implements StepWorker {

    private static final Logger log = LoggerFactory.getLogger(PromptedStepWorker.class);

    private final ClaudeClient claude;
    private final String       model;

    protected PromptedStepWorker(ClaudeClient claude, String model) {
        this.claude = claude;
        this.model  = model;
    }

    /** System prompt for this step. */
    protected abstract String systemPrompt();

    /** What the model must produce, including the expected JSON shape. */
    protected abstract String task(StepContext context);

    /**
     * Hook for step-specific checks on the recovered object.
     *
     * @throws WorkerException when the object is unusable
     */
    protected void validate(ObjectNode output) {}

    @Override
    public CandidateOutput invoke(StepContext context) {
        String prompt = buildPrompt(context);
        String raw;
        try {
            raw = claude.complete(model, systemPrompt(), List.of(Message.user(prompt)));
        } catch (ClaudeClient.ClaudeApiException e) {
            throw new WorkerException(kind(), "Claude call failed: " + e.getMessage(), e);
        }

        Optional<ResponseParser.Recovered> recovered = ResponseParser.recover(raw);
        if (recovered.isEmpty()) {
            throw new WorkerException(kind(), "Response contained no JSON object");
        }
        ObjectNode output = recovered.get().json();
        validate(output);
        log.debug("Worker '{}' produced {} top-level fields (via {})",
                kind().key(), output.size(), recovered.get().strategy());
        return CandidateOutput.fromJson(output);
    }

    String buildPrompt(StepContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Goal\n").append(context.goal()).append("\n\n");
        sb.append("# Inputs\n").append(context.inputsJson()).append("\n\n");
        sb.append("# Task\n").append(task(context)).append('\n');

        if (context.isRetry()) {
            sb.append("\n# Attempt ").append(context.attempt()).append(" of ").append(context.maxAttempts())
              .append('\n');
            if (context.previousOutput() != null) {
                sb.append("Your previous output:\n").append(context.previousOutput().payloadText()).append('\n');
            }
            if (!context.feedback().isEmpty()) {
                sb.append("\nA reviewer asked for these improvements. Apply all of them:\n");
                context.feedback().forEach(op -> sb.append("- ").append(op).append('\n'));
            }
        }

        sb.append("\nReply with a single fenced ```json block and nothing else.\n");
        return sb.toString();
    }

    protected static void require(StepKind kind, ObjectNode output, String field) {
        if (!output.hasNonNull(field)) {
            throw new WorkerException(kind, "Output is missing required field '" + field + "'");
        }
    }
}
