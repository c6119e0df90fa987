package com.extractpilot.orchestrator.repository;

import com.extractpilot.orchestrator.model.StepAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Append-only access to the step_attempts audit trail.
 */
public interface StepAttemptRepository extends JpaRepository<StepAttempt, UUID> {

    /** The full execution history of a run, in the order attempts happened. */
    List<StepAttempt> findByRunIdOrderBySequenceAsc(UUID runId);
}
