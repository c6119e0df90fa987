package com.extractpilot.orchestrator.confidence;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.worker.CandidateOutput;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks generated metadata against {@code extractpilot.validation.required-fields}.
 *
 * Errors: no {@code fields} array, or a required field absent or empty.
 * Warnings: populated fields without evidence, repeated field names.
 */
@Component
public class RequiredFieldsValidator implements ValidationSignal {

    private final List<String> requiredFields;

    public RequiredFieldsValidator(ExtractPilotProperties properties) {
        this.requiredFields = List.copyOf(properties.getValidation().getRequiredFields());
    }

    @Override
    public ValidationReport validate(CandidateOutput output) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        JsonNode fields = output == null ? null : output.payload().get("fields");
        if (fields == null || !fields.isArray()) {
            errors.add("Output has no fields array");
            return new ValidationReport(errors, warnings);
        }

        Set<String> populated = new HashSet<>();
        Set<String> seen = new HashSet<>();
        for (JsonNode field : fields) {
            String name = field.path("field_name").asText("");
            if (!name.isEmpty() && !seen.add(name)) {
                warnings.add("Field '" + name + "' appears more than once");
            }
            if (FieldStructuralMetrics.isPopulated(field.get("value"))) {
                populated.add(name);
                if (field.path("evidence").asText("").isBlank()) {
                    warnings.add("Field '" + name + "' has no evidence");
                }
            }
        }
        for (String required : requiredFields) {
            if (!populated.contains(required)) {
                errors.add("Required field '" + required + "' is missing or empty");
            }
        }
        return new ValidationReport(errors, warnings);
    }
}
