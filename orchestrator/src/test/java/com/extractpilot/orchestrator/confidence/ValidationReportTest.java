package com.extractpilot.orchestrator.confidence;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ValidationReportTest {

    @Test
    void score_noFindings_isOne() {
        assertThat(ValidationReport.clean().score(0.8)).isEqualTo(1.0);
    }

    @Test
    void score_warningsOnly_fivePointsEach() {
        ValidationReport report = new ValidationReport(List.of(), List.of("w1", "w2", "w3"));
        assertThat(report.score(0.8)).isCloseTo(0.85, within(1e-9));
    }

    @Test
    void score_errors_startFromPassTarget() {
        ValidationReport report = new ValidationReport(List.of("e1", "e2"), List.of("w1"));
        assertThat(report.score(0.8)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void score_manyErrors_clampedAtZero() {
        ValidationReport report = new ValidationReport(List.of("1", "2", "3", "4", "5"), List.of());
        assertThat(report.score(0.8)).isZero();
    }

    @Test
    void merge_concatenatesFindings() {
        ValidationReport merged = new ValidationReport(List.of("e1"), List.of())
                .merge(new ValidationReport(List.of(), List.of("w1")));

        assertThat(merged.errors()).containsExactly("e1");
        assertThat(merged.warnings()).containsExactly("w1");
    }
}
