package com.researchpipeline.orchestrator.repository;

import com.researchpipeline.orchestrator.model.StageAttempt;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * CRUD + history queries for the stage_attempts table.
 */
public interface StageAttemptRepository extends JpaRepository<StageAttempt, UUID> {

    /** A task's history in execution order. */
    List<StageAttempt> findByTaskIdOrderBySequenceAsc(UUID taskId);

    long countByTaskId(UUID taskId);
}
