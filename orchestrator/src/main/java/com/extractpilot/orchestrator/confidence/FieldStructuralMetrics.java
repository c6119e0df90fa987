package com.extractpilot.orchestrator.confidence;

import com.extractpilot.orchestrator.worker.CandidateOutput;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * Structural metrics for the pipeline's JSON outputs.
 *
 * Metadata outputs carry a {@code fields} array of
 * {@code {field_name, value, evidence, confidence}} entries. For those:
 * <ul>
 *   <li>completion: entries whose value is non-empty and not just the field name</li>
 *   <li>evidence: entries with a non-blank evidence string</li>
 *   <li>self-confidence: mean of the entries' confidence, missing counts as 0</li>
 * </ul>
 * Any other JSON object is measured by the share of populated top-level
 * properties plus the mean of the worker's self-reported field confidence.
 */
@Component
public class FieldStructuralMetrics implements StructuralMetrics {

    @Override
    public Measurement measure(CandidateOutput output) {
        if (output == null) {
            return Measurement.NONE;
        }
        JsonNode payload = output.payload();
        JsonNode fields = payload.get("fields");
        if (fields != null && fields.isArray() && looksLikeMetadata(fields)) {
            return measureFields(fields);
        }
        if (payload.isObject()) {
            return measureObject(payload, output.fieldConfidence());
        }
        return Measurement.NONE;
    }

    private static Measurement measureFields(JsonNode fields) {
        int total = fields.size();
        if (total == 0) {
            return new Measurement(0.0, 0.0, 0.0);
        }
        int withValue = 0;
        int withEvidence = 0;
        double confidenceSum = 0.0;
        for (JsonNode field : fields) {
            JsonNode value = field.get("value");
            if (isPopulated(value) && !value.asText().equals(field.path("field_name").asText(null))) {
                withValue++;
            }
            if (!field.path("evidence").asText("").isBlank()) {
                withEvidence++;
            }
            JsonNode c = field.get("confidence");
            if (c != null && c.isNumber()) {
                confidenceSum += ConfidenceAggregator.clamp(c.asDouble());
            }
        }
        return new Measurement(
                (double) withValue / total,
                (double) withEvidence / total,
                confidenceSum / total);
    }

    private static Measurement measureObject(JsonNode payload, Map<String, Double> fieldConfidence) {
        int total = 0;
        int populated = 0;
        Iterator<Map.Entry<String, JsonNode>> it = payload.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if ("field_confidence".equals(e.getKey())) {
                continue;
            }
            total++;
            if (isPopulated(e.getValue())) {
                populated++;
            }
        }
        Double completion = total == 0 ? 0.0 : (double) populated / total;
        Double self = fieldConfidence.isEmpty()
                ? null
                : fieldConfidence.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new Measurement(completion, null, self);
    }

    // a "fields" array of plain strings (e.g. a term list) is not metadata output
    private static boolean looksLikeMetadata(JsonNode fields) {
        for (JsonNode field : fields) {
            if (!field.isObject() || !field.has("field_name")) {
                return false;
            }
        }
        return true;
    }

    static boolean isPopulated(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isBlank();
        }
        if (value.isContainerNode()) {
            return !value.isEmpty();
        }
        return true;
    }
}
