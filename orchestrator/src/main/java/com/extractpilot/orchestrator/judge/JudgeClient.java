package com.extractpilot.orchestrator.judge;

/**
 * Raw call to the judge model.
 *
 * Returns whatever text the model produced; {@link RubricEvaluator} owns
 * turning it into a {@link JudgeVerdict}.
 */
public interface JudgeClient {

    /**
     * @throws JudgeException when the judge cannot be reached or refuses the call
     */
    String callJudge(Rubric rubric, String prompt) throws JudgeException;
}
