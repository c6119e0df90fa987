package com.extractpilot.orchestrator.judge;

/**
 * What the control loop does with a scored attempt.
 *
 * Always derived from the numeric score through {@link DecisionThresholds};
 * a decision written by the judge model itself is never trusted.
 */
public enum Decision {
    ACCEPT,
    RETRY,
    ESCALATE
}
