package com.extractpilot.orchestrator.judge;

import com.extractpilot.orchestrator.config.ExtractPilotProperties;
import com.extractpilot.orchestrator.config.ExtractPilotProperties.RubricSettings;
import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.retry.EscalationPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Rubrics per step-kind, built once from {@code extractpilot.rubrics.*}.
 *
 * A step without a rubric still runs: the evaluator escalates it and the
 * controller falls back to {@link DecisionThresholds#DEFAULT} and
 * {@link EscalationPolicy#RETRY}.
 */
@Component
public class RubricRegistry {

    private static final Logger log = LoggerFactory.getLogger(RubricRegistry.class);

    private final Map<StepKind, Rubric> rubrics = new EnumMap<>(StepKind.class);

    public RubricRegistry(ExtractPilotProperties properties) {
        for (StepKind kind : StepKind.values()) {
            RubricSettings settings = properties.getRubrics().get(kind.key());
            if (settings == null) {
                log.warn("No rubric configured for step '{}'; its attempts will escalate", kind.key());
                continue;
            }
            Rubric rubric = new Rubric(
                    kind,
                    settings.getDescription(),
                    settings.getCriteria(),
                    new DecisionThresholds(settings.getAcceptThreshold(), settings.getReviseMin()),
                    settings.getEscalation());
            rubrics.put(kind, rubric);
            log.info("Registered rubric '{}' ({} dimensions, accept>={}, revise>={}, escalation={})",
                    kind.key(), rubric.dimensions().size(),
                    rubric.thresholds().acceptThreshold(), rubric.thresholds().reviseMin(),
                    rubric.escalation());
        }
    }

    public Optional<Rubric> find(StepKind kind) {
        return Optional.ofNullable(rubrics.get(kind));
    }

    public DecisionThresholds thresholdsFor(StepKind kind) {
        return find(kind).map(Rubric::thresholds).orElse(DecisionThresholds.DEFAULT);
    }

    public EscalationPolicy escalationFor(StepKind kind) {
        return find(kind).map(Rubric::escalation).orElse(EscalationPolicy.RETRY);
    }
}
