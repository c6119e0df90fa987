package com.extractpilot.orchestrator.retry;

import com.extractpilot.orchestrator.model.StepKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StagnationDetectorTest {

    @Test
    void observe_threeIdenticalScores_signalsOnThird() {
        StagnationDetector detector = new StagnationDetector(2);

        assertThat(detector.observe(StepKind.PARSE, 0.6)).isFalse();
        assertThat(detector.observe(StepKind.PARSE, 0.6)).isFalse();
        assertThat(detector.observe(StepKind.PARSE, 0.6)).isTrue();
    }

    @Test
    void observe_changedScore_resetsCount() {
        StagnationDetector detector = new StagnationDetector(2);

        detector.observe(StepKind.PARSE, 0.6);
        detector.observe(StepKind.PARSE, 0.6);
        assertThat(detector.observe(StepKind.PARSE, 0.65)).isFalse();
        assertThat(detector.repeats(StepKind.PARSE)).isZero();
        assertThat(detector.observe(StepKind.PARSE, 0.65)).isFalse();
        assertThat(detector.observe(StepKind.PARSE, 0.65)).isTrue();
    }

    @Test
    void observe_stepKindsTrackedSeparately() {
        StagnationDetector detector = new StagnationDetector(1);

        detector.observe(StepKind.PARSE, 0.5);
        assertThat(detector.observe(StepKind.RETRIEVE, 0.5)).isFalse();
        assertThat(detector.observe(StepKind.PARSE, 0.5)).isTrue();
    }

    @Test
    void observe_decreasingScores_neverSignal() {
        StagnationDetector detector = new StagnationDetector(2);

        for (double s = 0.9; s > 0.0; s -= 0.1) {
            assertThat(detector.observe(StepKind.GENERATE, s)).isFalse();
        }
    }
}
