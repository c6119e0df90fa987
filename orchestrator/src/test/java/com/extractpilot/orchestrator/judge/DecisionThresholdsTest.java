package com.extractpilot.orchestrator.judge;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionThresholdsTest {

    private final DecisionThresholds bands = new DecisionThresholds(0.7, 0.4);

    @Test
    void decide_bandsAreInclusiveAtTheirLowerBound() {
        assertThat(bands.decide(1.0)).isEqualTo(Decision.ACCEPT);
        assertThat(bands.decide(0.7)).isEqualTo(Decision.ACCEPT);
        assertThat(bands.decide(0.69)).isEqualTo(Decision.RETRY);
        assertThat(bands.decide(0.4)).isEqualTo(Decision.RETRY);
        assertThat(bands.decide(0.39)).isEqualTo(Decision.ESCALATE);
        assertThat(bands.decide(0.0)).isEqualTo(Decision.ESCALATE);
    }

    @Test
    void decide_sweepOverUnitInterval_matchesBandDefinition() {
        for (int i = 0; i <= 100; i++) {
            double s = i / 100.0;
            Decision expected = s >= 0.7 ? Decision.ACCEPT : s < 0.4 ? Decision.ESCALATE : Decision.RETRY;
            assertThat(bands.decide(s)).as("score %s", s).isEqualTo(expected);
        }
    }

    @Test
    void decide_nan_escalates() {
        assertThat(bands.decide(Double.NaN)).isEqualTo(Decision.ESCALATE);
    }

    @Test
    void constructor_reviseMinAboveAccept_throws() {
        assertThatThrownBy(() -> new DecisionThresholds(0.5, 0.6))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_outOfRange_throws() {
        assertThatThrownBy(() -> new DecisionThresholds(1.2, 0.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DecisionThresholds(0.8, -0.1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rederive_overridesDisagreeingDecision() {
        JudgeVerdict claimed = new JudgeVerdict(0.9, Decision.RETRY, "", null, null, false);
        assertThat(claimed.rederive(bands).decision()).isEqualTo(Decision.ACCEPT);
    }

    @Test
    void rederive_parseFailureStaysEscalated() {
        JudgeVerdict failed = JudgeVerdict.unparseable("garbage");
        assertThat(failed.rederive(new DecisionThresholds(0.0, 0.0)).decision()).isEqualTo(Decision.ESCALATE);
    }
}
