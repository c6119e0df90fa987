package com.extractpilot.orchestrator.judge;

import java.util.List;

/**
 * The judge's structured assessment of one attempt.
 *
 * @param score          quality in [0, 1]; the only field that drives control flow
 * @param decision       derived from {@code score} via {@link DecisionThresholds}
 * @param critique       one-line summary for humans
 * @param issues         problems found, in the order the judge listed them
 * @param improvementOps short actionable instructions for the next attempt
 * @param parseFailure   true when the judge response could not be parsed;
 *                       such verdicts carry score 0 and decision ESCALATE
 */
public record JudgeVerdict(
        double       score,
        Decision     decision,
        String       critique,
        List<String> issues,
        List<String> improvementOps,
        boolean      parseFailure
) {

    public JudgeVerdict {
        critique       = critique == null ? "" : critique;
        issues         = issues == null ? List.of() : List.copyOf(issues);
        improvementOps = improvementOps == null ? List.of() : List.copyOf(improvementOps);
    }

    /**
     * Verdict used when no usable judgement exists (unparseable response,
     * missing rubric). Escalates, never throws.
     */
    public static JudgeVerdict unparseable(String reason) {
        return new JudgeVerdict(0.0, Decision.ESCALATE,
                "Judge failure: " + reason, List.of(reason), List.of(), true);
    }

    /** Same verdict with the decision re-derived from the score. */
    public JudgeVerdict rederive(DecisionThresholds thresholds) {
        Decision derived = parseFailure ? Decision.ESCALATE : thresholds.decide(score);
        return derived == decision
                ? this
                : new JudgeVerdict(score, derived, critique, issues, improvementOps, parseFailure);
    }
}
