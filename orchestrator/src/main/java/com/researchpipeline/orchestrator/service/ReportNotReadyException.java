package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.model.TaskStatus;

import java.util.UUID;

/**
 * The task exists but has no report yet. Distinct from "not found" so
 * clients know to keep polling.
 */
public class ReportNotReadyException extends RuntimeException {

    private final UUID       taskId;
    private final TaskStatus status;

    public ReportNotReadyException(UUID taskId, TaskStatus status) {
        super("Report for task " + taskId + " is not available. Current status: " + status);
        this.taskId = taskId;
        this.status = status;
    }

    public UUID       getTaskId() { return taskId; }
    public TaskStatus getStatus() { return status; }
}
