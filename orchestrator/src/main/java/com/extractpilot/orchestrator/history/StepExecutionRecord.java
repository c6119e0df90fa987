package com.extractpilot.orchestrator.history;

import com.extractpilot.orchestrator.judge.JudgeVerdict;
import com.extractpilot.orchestrator.model.StepKind;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * One attempt of one step, as it happened. Immutable once appended.
 *
 * @param stepKind   step the attempt belongs to
 * @param attempt    1-based attempt index within the step
 * @param output     snapshot of the candidate output, null if the worker failed
 * @param verdict    judge verdict, null if there was nothing to judge or the judge call failed
 * @param failure    failure marker (exception message), null on a judged attempt
 * @param startedAt  when the worker was invoked
 * @param finishedAt when the verdict (or failure) was known
 */
public record StepExecutionRecord(
        StepKind     stepKind,
        int          attempt,
        JsonNode     output,
        JudgeVerdict verdict,
        String       failure,
        Instant      startedAt,
        Instant      finishedAt
) {

    public StepExecutionRecord {
        output = output == null ? null : output.deepCopy();
    }

    public boolean failed() {
        return failure != null;
    }

    /** The judge score, or null when the attempt has no verdict. */
    public Double score() {
        return verdict == null ? null : verdict.score();
    }
}
