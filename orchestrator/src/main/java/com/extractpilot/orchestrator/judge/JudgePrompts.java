package com.extractpilot.orchestrator.judge;

import java.util.List;
import java.util.Map;

/**
 * Builds the judge prompt for one attempt.
 *
 * The prompt asks for a fenced JSON object with score, critique, issues and
 * improvement_ops. It deliberately does not ask for a decision: the decision
 * is computed from the score.
 */
public final class JudgePrompts {

    static final String SYSTEM_PROMPT =
            "You are an impartial reviewer of document-extraction output. You return JSON verdicts only.";

    // Excerpts longer than this are cut so a large document cannot blow up the prompt.
    static final int MAX_EXCERPT_CHARS = 12_000;

    private JudgePrompts() {}

    public static String build(Rubric rubric, EvaluationContext ctx, List<String> priorFeedback) {
        StringBuilder sb = new StringBuilder();

        sb.append("# Step: ").append(rubric.stepKind().key()).append('\n');
        sb.append("Goal: ").append(rubric.goal().isBlank() ? ctx.goal() : rubric.goal()).append("\n");
        sb.append("Attempt ").append(ctx.attempt()).append(" of ").append(ctx.maxAttempts()).append("\n\n");

        sb.append("## Rubric\n");
        if (rubric.dimensions().isEmpty()) {
            sb.append("- General quality: the output fulfils the goal accurately and completely.\n");
        }
        for (Map.Entry<String, List<String>> dim : rubric.dimensions().entrySet()) {
            sb.append("- ").append(dim.getKey()).append(":\n");
            if (dim.getValue().isEmpty()) {
                sb.append("    - (no checks provided)\n");
            }
            dim.getValue().forEach(check -> sb.append("    - ").append(check).append('\n'));
        }

        sb.append("\n## Step inputs\n").append(excerpt(ctx.inputs())).append("\n");
        sb.append("\n## Candidate output\n").append(excerpt(ctx.output())).append("\n");

        if (!priorFeedback.isEmpty()) {
            sb.append("\n## Improvements requested on earlier attempts\n");
            sb.append("Check whether each one has now been addressed.\n");
            priorFeedback.forEach(op -> sb.append("- ").append(op).append('\n'));
        }

        sb.append("""

                ## Output format
                Reply with a single fenced JSON block and nothing else:
                ```json
                {
                  "score": 0.0,
                  "critique": "summary under 200 characters",
                  "issues": ["issue under 100 characters"],
                  "improvement_ops": ["actionable instruction under 150 characters"]
                }
                ```
                score is a number between 0.0 and 1.0. No comments inside the JSON.
                """);
        return sb.toString();
    }

    static String excerpt(String text) {
        if (text == null || text.isBlank()) {
            return "(empty)";
        }
        if (text.length() <= MAX_EXCERPT_CHARS) {
            return text;
        }
        return text.substring(0, MAX_EXCERPT_CHARS)
                + "\n... [truncated " + (text.length() - MAX_EXCERPT_CHARS) + " characters]";
    }
}
