package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.model.StepKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Flags a step whose judge score stops moving.
 *
 * Every score equal to the one before it counts as a repeat; any change
 * resets the count. With a limit of 2, the scores 0.6, 0.6, 0.6 signal
 * no progress on the third observation. Scores are compared exactly since
 * the judge reports them at fixed granularity.
 */
public class StagnationDetector {

    private final int repeatLimit;
    private final Map<StepKind, Double>  lastScore = new EnumMap<>(StepKind.class);
    private final Map<StepKind, Integer> repeats   = new EnumMap<>(StepKind.class);

    public StagnationDetector(int repeatLimit) {
        if (repeatLimit < 1) {
            throw new IllegalArgumentException("repeatLimit must be >= 1, was " + repeatLimit);
        }
        this.repeatLimit = repeatLimit;
    }

    /**
     * Record a score.
     *
     * @return true when the last {@code repeatLimit} observations all repeated their predecessor
     */
    public boolean observe(StepKind kind, double score) {
        Double previous = lastScore.put(kind, score);
        int count = previous != null && Double.compare(previous, score) == 0
                ? repeats.getOrDefault(kind, 0) + 1
                : 0;
        repeats.put(kind, count);
        return count >= repeatLimit;
    }

    /** Consecutive repeats seen so far for the step-kind. */
    public int repeats(StepKind kind) {
        return repeats.getOrDefault(kind, 0);
    }

    public void reset(StepKind kind) {
        lastScore.remove(kind);
        repeats.remove(kind);
    }
}
