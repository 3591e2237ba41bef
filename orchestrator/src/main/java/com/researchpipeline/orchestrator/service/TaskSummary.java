package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.model.Task;

import java.time.Instant;
import java.util.UUID;

/**
 * List view of a task, as returned by GET /tasks.
 */
public record TaskSummary(
        UUID    taskId,
        String  query,
        String  status,
        String  currentStage,
        String  errorMessage,
        boolean reportAvailable,
        Instant createdAt,
        Instant updatedAt
) {
    public static TaskSummary from(Task task) {
        return new TaskSummary(
                task.getId(),
                task.getQuery(),
                task.getStatus().name(),
                task.getCurrentStage(),
                task.getErrorMessage(),
                task.getStatus().hasReport(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
