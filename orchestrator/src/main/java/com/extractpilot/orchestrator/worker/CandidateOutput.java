package com.extractpilot.orchestrator.worker;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a worker produced for one attempt.
 *
 * @param payload         the structured output, opaque to the control loop
 * @param fieldConfidence the worker's own per-field confidence in [0, 1], possibly empty
 */
public record CandidateOutput(JsonNode payload, Map<String, Double> fieldConfidence) {

    public CandidateOutput {
        if (payload == null) {
            throw new IllegalArgumentException("payload must not be null");
        }
        payload         = payload.deepCopy();
        fieldConfidence = fieldConfidence == null
                ? Map.of()
                : Collections.unmodifiableMap(usableConfidence(fieldConfidence));
    }

    /**
     * Wrap a worker's JSON, picking up self-reported confidence from either
     * {@code fields[].confidence} (keyed by {@code field_name}) or a
     * top-level {@code field_confidence} object.
     */
    public static CandidateOutput fromJson(JsonNode payload) {
        Map<String, Double> confidence = new LinkedHashMap<>();
        JsonNode fields = payload.get("fields");
        if (fields != null && fields.isArray()) {
            int index = 0;
            for (JsonNode field : fields) {
                JsonNode c = field.get("confidence");
                if (c != null && c.isNumber()) {
                    String name = field.path("field_name").asText("field_" + index);
                    confidence.put(name, clamp(c.asDouble()));
                }
                index++;
            }
        }
        JsonNode declared = payload.get("field_confidence");
        if (declared != null && declared.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = declared.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                if (e.getValue().isNumber()) {
                    confidence.putIfAbsent(e.getKey(), clamp(e.getValue().asDouble()));
                }
            }
        }
        return new CandidateOutput(payload, confidence);
    }

    public String payloadText() {
        return payload.toPrettyString();
    }

    // entries without a finite score carry no confidence and are dropped
    private static Map<String, Double> usableConfidence(Map<String, Double> raw) {
        Map<String, Double> usable = new LinkedHashMap<>();
        raw.forEach((field, score) -> {
            if (field != null && score != null && Double.isFinite(score)) {
                usable.put(field, clamp(score));
            }
        });
        return usable;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
