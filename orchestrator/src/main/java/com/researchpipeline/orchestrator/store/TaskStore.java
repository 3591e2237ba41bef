package com.researchpipeline.orchestrator.store;

import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.StageAttempt;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Durable record of every pipeline run and its stage history.
 *
 * The store is the only owner of {@link Task} and {@link StageAttempt} rows.
 * All mutating operations on the same task are linearizable. Methods that
 * take a task id throw {@link TaskNotFoundException} for unknown ids; status
 * changes that the task's lifecycle forbids throw
 * {@link InvalidStatusTransitionException}.
 *
 * Listings are ordered most-recent-first by creation time.
 */
public interface TaskStore {

    /** Persist a new task in status PENDING. {@code query} may be null. */
    Task create(String query, Map<String, Object> parameters);

    Task get(UUID taskId);

    /** Append an attempt at the end of the task's history; returns it with its sequence set. */
    StageAttempt appendStageAttempt(UUID taskId, StageAttempt attempt);

    Task updateStatus(UUID taskId, TaskStatus newStatus);

    /** Replace the report of a task that is COMPLETED, PENDING_REVIEW or APPROVED. */
    Task setReport(UUID taskId, String report);

    /**
     * PENDING_REVIEW → APPROVED with a replacement report, in one write. The
     * status is checked under the row lock.
     */
    Task editAndApprove(UUID taskId, String report);

    /** COMPLETED or PENDING_REVIEW → REJECTED; the report is dropped and the reason kept as error message. */
    Task reject(UUID taskId, String reason);

    /** RUNNING → COMPLETED and the report, in one write. */
    Task complete(UUID taskId, String report);

    /** Move to FAILED or CANCELLED with an error message. */
    Task fail(UUID taskId, TaskStatus terminalStatus, String message);

    /** Record which stage the executor most recently started. */
    void markStageStarted(UUID taskId, String stageName);

    /**
     * Flag a PENDING or RUNNING task for cancellation.
     *
     * @throws InvalidStatusTransitionException if the task already reached a terminal status
     */
    Task requestCancel(UUID taskId);

    /** Tasks whose status is in {@code statuses}; an empty set means every task. */
    List<Task> listByStatus(Set<TaskStatus> statuses);

    /** Same ordering as {@link #listByStatus(Set)}, one window of it. */
    List<Task> listByStatus(Set<TaskStatus> statuses, int offset, int limit);

    /** The task's attempts in execution order. */
    List<StageAttempt> history(UUID taskId);
}
