package com.extractpilot.orchestrator.confidence;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fuses independent quality signals into one confidence score.
 *
 * For every available source the weighted score is summed and then divided
 * by the total weight of the available sources, so a missing signal does not
 * drag the result down. A source is unavailable when its score is null or
 * NaN; a source without an entry in the weight table contributes weight 0.
 *
 * {@link #aggregate} is pure and static. The bean only supplies the
 * configured default weights and review threshold.
 */
@Component
public class ConfidenceAggregator {

    public static final String JUDGE      = "judge";
    public static final String STRUCTURAL = "structural";
    public static final String VALIDATION = "validation";

    private final Map<String, Double> defaultWeights;
    private final double              defaultReviewThreshold;

    public ConfidenceAggregator(ExtractPilotProperties properties) {
        this.defaultWeights         = Map.copyOf(properties.getConfidence().getWeights());
        this.defaultReviewThreshold = properties.getConfidence().getReviewThreshold();
    }

    /** Aggregate with the configured weights and threshold. */
    public ConfidenceBreakdown breakdown(Map<String, Double> sources) {
        return aggregate(sources, defaultWeights, defaultReviewThreshold);
    }

    /**
     * Aggregate with optional overrides; null arguments fall back to configuration.
     */
    public ConfidenceBreakdown breakdown(Map<String, Double> sources,
                                         Map<String, Double> weights,
                                         Double reviewThreshold) {
        return aggregate(sources,
                weights == null ? defaultWeights : weights,
                reviewThreshold == null ? defaultReviewThreshold : reviewThreshold);
    }

    public Map<String, Double> defaultWeights() {
        return defaultWeights;
    }

    // ------------------------------------------------------------------
    // Pure aggregation
    // ------------------------------------------------------------------

    /**
     * @param sources         score per source; null or NaN means unavailable
     * @param weights         non-negative finite weight per source
     * @param reviewThreshold overall scores below this need human review
     * @throws IllegalArgumentException on a negative or non-finite weight, or a NaN threshold
     */
    public static ConfidenceBreakdown aggregate(Map<String, Double> sources,
                                                Map<String, Double> weights,
                                                double reviewThreshold) {
        if (Double.isNaN(reviewThreshold)) {
            throw new IllegalArgumentException("reviewThreshold must be a number");
        }
        Map<String, Double> weightTable = weights == null ? Map.of() : weights;
        weightTable.forEach((name, w) -> {
            if (w == null || !Double.isFinite(w) || w < 0.0) {
                throw new IllegalArgumentException("Weight for '" + name + "' must be a non-negative finite number, was " + w);
            }
        });

        Map<String, Double> components = new LinkedHashMap<>();
        double maxWeight = 0.0;
        if (sources != null) {
            for (Map.Entry<String, Double> source : sources.entrySet()) {
                Double score = source.getValue();
                if (score == null || Double.isNaN(score)) {
                    components.put(source.getKey(), null);
                    continue;
                }
                components.put(source.getKey(), clamp(score));
                maxWeight = Math.max(maxWeight, weightTable.getOrDefault(source.getKey(), 0.0));
            }
        }

        Map<String, Double> effective = new LinkedHashMap<>();
        if (maxWeight <= 0.0) {
            // nothing usable: no available source, or only zero-weight ones
            for (Map.Entry<String, Double> c : components.entrySet()) {
                if (c.getValue() != null) {
                    effective.put(c.getKey(), 0.0);
                }
            }
            return new ConfidenceBreakdown(components, effective, 0.0, true, Map.of());
        }

        // scaled weights lie in [0, 1], so the sum stays finite
        double scaledSum = 0.0;
        for (Map.Entry<String, Double> c : components.entrySet()) {
            if (c.getValue() != null) {
                scaledSum += weightTable.getOrDefault(c.getKey(), 0.0) / maxWeight;
            }
        }
        double weighted = 0.0;
        for (Map.Entry<String, Double> c : components.entrySet()) {
            if (c.getValue() == null) {
                continue;
            }
            double w = weightTable.getOrDefault(c.getKey(), 0.0) / maxWeight / scaledSum;
            effective.put(c.getKey(), w);
            weighted += w * c.getValue();
        }

        double overall = clamp(weighted);
        return new ConfidenceBreakdown(components, effective, overall, overall < reviewThreshold, Map.of());
    }

    static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
