package com.extractpilot.orchestrator.confidence;

import java.util.ArrayList;
import java.util.List;

/**
 * Findings of an external consistency check.
 */
public record ValidationReport(List<String> errors, List<String> warnings) {

    public ValidationReport {
        errors   = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ValidationReport clean() {
        return new ValidationReport(List.of(), List.of());
    }

    public boolean isClean() {
        return errors.isEmpty() && warnings.isEmpty();
    }

    /**
     * Validation signal in [0, 1]: 1.0 without findings, minus 0.05 per
     * warning when there are only warnings, and {@code passTarget} minus 0.2
     * per error otherwise.
     */
    public double score(double passTarget) {
        double score;
        if (isClean()) {
            score = 1.0;
        } else if (errors.isEmpty()) {
            score = 1.0 - 0.05 * warnings.size();
        } else {
            score = passTarget - 0.2 * errors.size();
        }
        return ConfidenceAggregator.clamp(score);
    }

    public ValidationReport merge(ValidationReport other) {
        List<String> e = new ArrayList<>(errors);
        List<String> w = new ArrayList<>(warnings);
        e.addAll(other.errors());
        w.addAll(other.warnings());
        return new ValidationReport(e, w);
    }
}
