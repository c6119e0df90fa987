package com.extractpilot.orchestrator.repository;

import com.extractpilot.orchestrator.model.DocumentRun;
import com.extractpilot.orchestrator.model.RunState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the document_runs table.
 */
public interface DocumentRunRepository extends JpaRepository<DocumentRun, UUID> {

    /**
     * Claim the oldest PENDING run.
     *
     * PESSIMISTIC_WRITE with lock timeout -2 renders as
     * SELECT ... FOR UPDATE SKIP LOCKED on PostgreSQL, so concurrent
     * scheduler ticks never claim the same run.
     *
     * Must run inside a @Transactional method that sets state = RUNNING
     * before the transaction commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "-2"))
    @Query("""
            SELECT r FROM DocumentRun r
            WHERE r.state = 'PENDING'
            ORDER BY r.createdAt ASC
            LIMIT 1
            """)
    Optional<DocumentRun> claimNextPendingRun();

    List<DocumentRun> findByState(RunState state);

    /** RUNNING runs whose worker stopped recording attempts before 'cutoff'. */
    List<DocumentRun> findByStateAndHeartbeatAtBefore(RunState state, Instant cutoff);
}
