package com.extractpilot.orchestrator.judge;

/**
 * Score bands that map a judge score to a {@link Decision}.
 *
 * <pre>
 *   score ≥ acceptThreshold                → ACCEPT
 *   reviseMin ≤ score &lt; acceptThreshold  → RETRY
 *   score &lt; reviseMin                     → ESCALATE
 * </pre>
 *
 * @param acceptThreshold lowest score that is accepted as-is
 * @param reviseMin       lowest score still worth another attempt
 */
public record DecisionThresholds(double acceptThreshold, double reviseMin) {

    public static final DecisionThresholds DEFAULT = new DecisionThresholds(0.8, 0.5);

    public DecisionThresholds {
        if (reviseMin < 0.0 || acceptThreshold > 1.0 || reviseMin > acceptThreshold) {
            throw new IllegalArgumentException(
                    "Thresholds must satisfy 0 <= reviseMin <= acceptThreshold <= 1, got reviseMin=%s acceptThreshold=%s"
                            .formatted(reviseMin, acceptThreshold));
        }
    }

    /** NaN scores escalate. */
    public Decision decide(double score) {
        if (Double.isNaN(score)) {
            return Decision.ESCALATE;
        }
        if (score >= acceptThreshold) {
            return Decision.ACCEPT;
        }
        return score >= reviseMin ? Decision.RETRY : Decision.ESCALATE;
    }
}
