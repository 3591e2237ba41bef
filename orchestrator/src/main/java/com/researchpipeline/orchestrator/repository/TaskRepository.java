package com.researchpipeline.orchestrator.repository;

import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + query operations for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /**
     * Load a task and hold a row lock until the surrounding transaction ends.
     *
     * Every mutation of a task goes through this query first, which makes
     * writes to the same task linearizable: a second writer blocks on
     * SELECT ... FOR UPDATE until the first one commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Task t WHERE t.id = :id")
    Optional<Task> findByIdForUpdate(@Param("id") UUID id);

    /** Tasks in any of the given states, newest first. */
    List<Task> findByStatusInOrderByCreatedAtDescIdAsc(Collection<TaskStatus> statuses);

    /** All tasks, newest first. */
    List<Task> findAllByOrderByCreatedAtDescIdAsc();
}
