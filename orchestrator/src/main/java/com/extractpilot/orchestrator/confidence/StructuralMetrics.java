package com.extractpilot.orchestrator.confidence;

import com.extractpilot.orchestrator.worker.CandidateOutput;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Computes shape-based quality ratios from a candidate output, independently
 * of the judge.
 */
public interface StructuralMetrics {

    Measurement measure(CandidateOutput output);

    /**
     * Each ratio is in [0, 1], or null when it does not apply to the output.
     *
     * @param completion     fraction of expected fields that are populated
     * @param evidence       fraction of fields with supporting evidence
     * @param selfConfidence average confidence the worker reported for its fields
     */
    record Measurement(Double completion, Double evidence, Double selfConfidence) {

        public static final Measurement NONE = new Measurement(null, null, null);

        /** Mean of the available ratios, or null when none is available. */
        public Double score() {
            double sum = 0.0;
            int n = 0;
            for (Double part : new Double[] {completion, evidence, selfConfidence}) {
                if (part != null) {
                    sum += part;
                    n++;
                }
            }
            return n == 0 ? null : ConfidenceAggregator.clamp(sum / n);
        }

        public Map<String, Object> details() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("field_completion_ratio",  completion);
            details.put("evidence_coverage_ratio", evidence);
            details.put("avg_field_confidence",    selfConfidence);
            return details;
        }
    }
}
