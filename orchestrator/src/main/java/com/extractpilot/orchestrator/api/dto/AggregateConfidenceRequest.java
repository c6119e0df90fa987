package com.extractpilot.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /confidence.
 *
 * sources maps a source name to a score in [0, 1]; null means unavailable.
 * weights and reviewThreshold fall back to the configured defaults.
 */
public record AggregateConfidenceRequest(
        Map<String, Double> sources,
        Map<String, Double> weights,
        Double              reviewThreshold
) {}
