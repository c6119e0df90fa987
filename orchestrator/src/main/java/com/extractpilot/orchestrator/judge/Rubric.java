package com.extractpilot.orchestrator.judge;

import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.retry.EscalationPolicy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality criteria the judge applies to one step-kind.
 *
 * @param stepKind    the step this rubric scores
 * @param goal        what a good output achieves, shown to the judge
 * @param dimensions  dimension name → checks, in configuration order
 * @param thresholds  score bands for the decision
 * @param escalation  what the step does on an ESCALATE decision
 */
public record Rubric(
        StepKind                  stepKind,
        String                    goal,
        Map<String, List<String>> dimensions,
        DecisionThresholds        thresholds,
        EscalationPolicy          escalation
) {
    public Rubric {
        goal       = goal == null ? "" : goal;
        dimensions = dimensions == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(dimensions));
        thresholds = thresholds == null ? DecisionThresholds.DEFAULT : thresholds;
        escalation = escalation == null ? EscalationPolicy.RETRY : escalation;
    }
}
