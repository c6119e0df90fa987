package com.extractpilot.orchestrator.judge;

import com.extractpilot.orchestrator.claude.ClaudeClient;
import com.extractpilot.orchestrator.claude.ClaudeClient.Message;
import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * {@link JudgeClient} backed by the Anthropic Messages API.
 */
@Component
public class ClaudeJudgeClient implements JudgeClient {

    private final ClaudeClient claude;
    private final String       model;

    public ClaudeJudgeClient(ClaudeClient claude, ExtractPilotProperties properties) {
        this.claude = claude;
        this.model  = properties.getClaude().getJudgeModel();
    }

    @Override
    public String callJudge(Rubric rubric, String prompt) {
        try {
            return claude.complete(model, JudgePrompts.SYSTEM_PROMPT, List.of(Message.user(prompt)));
        } catch (RuntimeException e) {
            throw new JudgeException(
                    "Judge call for step '" + rubric.stepKind().key() + "' failed: " + e.getMessage(), e);
        }
    }
}
