package com.extractpilot.orchestrator.confidence;

import com.extractpilot.orchestrator.worker.CandidateOutput;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FieldStructuralMetricsTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final FieldStructuralMetrics metrics = new FieldStructuralMetrics();

    @Test
    void measure_metadataFields_computesThreeRatios() throws Exception {
        CandidateOutput output = CandidateOutput.fromJson(mapper.readTree("""
                {"fields": [
                  {"field_name": "study_title", "value": "Soil microbes", "evidence": "Title, p.1", "confidence": 0.9},
                  {"field_name": "lat_lon", "value": "lat_lon", "evidence": "", "confidence": 0.3},
                  {"field_name": "depth", "value": "", "evidence": "Methods", "confidence": 0.6},
                  {"field_name": "ph", "value": 6.5, "evidence": "Table 2"}
                ]}
                """));

        StructuralMetrics.Measurement m = metrics.measure(output);

        // value equal to the field name does not count as filled
        assertThat(m.completion()).isCloseTo(0.5, within(1e-9));
        assertThat(m.evidence()).isCloseTo(0.75, within(1e-9));
        assertThat(m.selfConfidence()).isCloseTo(0.45, within(1e-9));
        assertThat(m.score()).isCloseTo((0.5 + 0.75 + 0.45) / 3, within(1e-9));
    }

    @Test
    void measure_emptyFieldsArray_allZero() throws Exception {
        StructuralMetrics.Measurement m = metrics.measure(CandidateOutput.fromJson(mapper.readTree("{\"fields\": []}")));

        assertThat(m.score()).isZero();
    }

    @Test
    void measure_plainObject_usesPopulatedShareAndSelfConfidence() throws Exception {
        CandidateOutput output = CandidateOutput.fromJson(mapper.readTree("""
                {"title": "Soil microbes", "authors": [], "domain": "ecology", "methods": null,
                 "field_confidence": {"title": 0.9, "domain": 0.7}}
                """));

        StructuralMetrics.Measurement m = metrics.measure(output);

        assertThat(m.completion()).isCloseTo(0.5, within(1e-9));
        assertThat(m.evidence()).isNull();
        assertThat(m.selfConfidence()).isCloseTo(0.8, within(1e-9));
        assertThat(m.score()).isCloseTo(0.65, within(1e-9));
    }

    @Test
    void measure_stringFieldList_isTreatedAsPlainObject() throws Exception {
        CandidateOutput output = CandidateOutput.fromJson(mapper.readTree(
                "{\"packages\": [\"soil\"], \"fields\": [\"ph\", \"depth\"]}"));

        StructuralMetrics.Measurement m = metrics.measure(output);

        assertThat(m.completion()).isEqualTo(1.0);
        assertThat(m.selfConfidence()).isNull();
    }

    @Test
    void measure_confidenceWithMissingEntries_ignoresThem() throws Exception {
        Map<String, Double> reported = new HashMap<>();
        reported.put("title", 0.9);
        reported.put("authors", null);

        StructuralMetrics.Measurement m = metrics.measure(
                new CandidateOutput(mapper.readTree("{\"title\": \"A\"}"), reported));

        assertThat(m.completion()).isEqualTo(1.0);
        assertThat(m.selfConfidence()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void measure_nullOrScalarOutput_noMeasurement() throws Exception {
        assertThat(metrics.measure(null).score()).isNull();
        assertThat(metrics.measure(CandidateOutput.fromJson(mapper.readTree("42"))).score()).isNull();
    }
}
