package com.extractpilot.orchestrator.confidence;

import com.extractpilot.orchestrator.worker.CandidateOutput;

/**
 * A schema or consistency checker run against the final output of a run.
 * When no checker is registered the validation source is left out of the
 * run's confidence.
 */
public interface ValidationSignal {

    ValidationReport validate(CandidateOutput output);
}
