package com.extractpilot.orchestrator.confidence;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one confidence aggregation.
 *
 * @param components       score per source in [0, 1], or null when the source was unavailable
 * @param weights          effective weights after renormalisation, available sources only
 * @param overall          weighted score in [0, 1]
 * @param needsHumanReview true when {@code overall} is below the review threshold
 * @param details          source-specific diagnostics (ratios, counts), for humans only
 */
public record ConfidenceBreakdown(
        Map<String, Double> components,
        Map<String, Double> weights,
        double              overall,
        boolean             needsHumanReview,
        Map<String, Object> details
) {

    public ConfidenceBreakdown {
        // LinkedHashMap, not Map.copyOf: unavailable components are kept as null values
        components = Collections.unmodifiableMap(new LinkedHashMap<>(components == null ? Map.of() : components));
        weights    = Collections.unmodifiableMap(new LinkedHashMap<>(weights == null ? Map.of() : weights));
        details    = Collections.unmodifiableMap(new LinkedHashMap<>(details == null ? Map.of() : details));
    }

    public ConfidenceBreakdown withDetails(Map<String, Object> extra) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.putAll(extra);
        return new ConfidenceBreakdown(components, weights, overall, needsHumanReview, merged);
    }
}
