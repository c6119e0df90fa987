package com.extractpilot.orchestrator.judge;

import com.extractpilot.orchestrator.model.StepKind;
import com.extractpilot.orchestrator.parse.ResponseParser;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Scores one attempt against its step's rubric.
 *
 * <ol>
 *   <li>Look up the rubric; a missing rubric yields an ESCALATE verdict.</li>
 *   <li>Build the prompt and call the judge. A failed call raises
 *       {@link JudgeException}; the retry controller records it as a failed attempt.</li>
 *   <li>Recover a JSON object with {@link ResponseParser}. If none is found,
 *       or it has no numeric score, the verdict is ESCALATE with score 0.</li>
 *   <li>Derive the decision from the score. A "decision" field in the judge's
 *       JSON is logged and otherwise ignored.</li>
 * </ol>
 *
 * Metrics:
 * <pre>
 *   extractpilot.judge.verdicts{step, decision}
 *   extractpilot.judge.parse_failures{step}
 * </pre>
 */
@Component
public class RubricEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RubricEvaluator.class);

    private final JudgeClient    judgeClient;
    private final RubricRegistry rubrics;
    private final MeterRegistry  meterRegistry;

    public RubricEvaluator(JudgeClient judgeClient, RubricRegistry rubrics, MeterRegistry meterRegistry) {
        this.judgeClient   = judgeClient;
        this.rubrics       = rubrics;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Judge one attempt.
     *
     * @param ctx           goal, input and output excerpts of the attempt
     * @param priorFeedback improvement ops accumulated on earlier attempts of this step
     * @throws JudgeException if the judge produced no response at all
     */
    public JudgeVerdict evaluate(EvaluationContext ctx, List<String> priorFeedback) {
        StepKind kind = ctx.stepKind();
        Optional<Rubric> rubric = rubrics.find(kind);
        if (rubric.isEmpty()) {
            return record(kind, JudgeVerdict.unparseable("No rubric defined for step '" + kind.key() + "'"));
        }

        String prompt = JudgePrompts.build(rubric.get(), ctx, priorFeedback);
        String raw = judgeClient.callJudge(rubric.get(), prompt);
        log.debug("Judge response for step '{}' ({} chars)", kind.key(), raw == null ? 0 : raw.length());

        return record(kind, toVerdict(raw, rubric.get().thresholds()));
    }

    /**
     * Parse a raw judge response into a verdict. Never throws.
     */
    public static JudgeVerdict toVerdict(String raw, DecisionThresholds thresholds) {
        Optional<ResponseParser.Recovered> recovered = ResponseParser.recover(raw);
        if (recovered.isEmpty()) {
            log.warn("Judge response is not parseable; preview: {}", preview(raw));
            return JudgeVerdict.unparseable("Unable to parse judge JSON response");
        }
        ObjectNode json = recovered.get().json();
        if (recovered.get().strategy() != ResponseParser.Strategy.DIRECT) {
            log.debug("Judge JSON recovered via {}", recovered.get().strategy());
        }

        OptionalScore score = readScore(json.get("score"));
        if (!score.present()) {
            log.warn("Judge JSON has no numeric score; preview: {}", preview(raw));
            return JudgeVerdict.unparseable("Judge response has no numeric score");
        }

        Decision derived = thresholds.decide(score.value());
        JsonNode claimed = json.get("decision");
        if (claimed != null && claimed.isTextual() && !claimed.asText().equalsIgnoreCase(derived.name())) {
            log.debug("Judge wrote decision '{}' but score {} maps to {}; using {}",
                    claimed.asText(), score.value(), derived, derived);
        }

        List<String> ops = strings(json.get("improvement_ops"));
        if (ops.isEmpty()) {
            ops = strings(json.get("suggestions"));
        }

        return new JudgeVerdict(
                score.value(),
                derived,
                json.path("critique").asText(""),
                strings(json.get("issues")),
                ops,
                false);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private JudgeVerdict record(StepKind kind, JudgeVerdict verdict) {
        meterRegistry.counter("extractpilot.judge.verdicts",
                "step", kind.key(), "decision", verdict.decision().name()).increment();
        if (verdict.parseFailure()) {
            meterRegistry.counter("extractpilot.judge.parse_failures", "step", kind.key()).increment();
        }
        log.info("Judge verdict for step '{}': score={} decision={} issues={} improvements={}",
                kind.key(), "%.2f".formatted(verdict.score()), verdict.decision(),
                verdict.issues().size(), verdict.improvementOps().size());
        return verdict;
    }

    private record OptionalScore(boolean present, double value) {}

    private static OptionalScore readScore(JsonNode node) {
        if (node == null || node.isNull()) {
            return new OptionalScore(false, 0.0);
        }
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().strip());
            } catch (NumberFormatException e) {
                return new OptionalScore(false, 0.0);
            }
        } else {
            return new OptionalScore(false, 0.0);
        }
        if (Double.isNaN(value)) {
            return new OptionalScore(false, 0.0);
        }
        return new OptionalScore(true, Math.max(0.0, Math.min(1.0, value)));
    }

    private static List<String> strings(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode item : node) {
            String text = item.isTextual() ? item.asText() : item.toString();
            if (!text.isBlank()) {
                out.add(text.strip());
            }
        }
        return out;
    }

    private static String preview(String raw) {
        if (raw == null) {
            return "(null)";
        }
        return raw.length() <= 500 ? raw : raw.substring(0, 500) + "...";
    }
}
