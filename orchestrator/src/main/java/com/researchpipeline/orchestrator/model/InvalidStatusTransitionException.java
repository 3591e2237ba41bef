package com.researchpipeline.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a task is asked to move to a status its current status
 * does not allow (see {@link TaskStatus#canTransitionTo}).
 */
public class InvalidStatusTransitionException extends RuntimeException {

    private final TaskStatus from;
    private final TaskStatus to;

    public InvalidStatusTransitionException(UUID taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to   = to;
    }

    public InvalidStatusTransitionException(UUID taskId, String message) {
        super("Task " + taskId + ": " + message);
        this.from = null;
        this.to   = null;
    }

    public TaskStatus getFrom() { return from; }
    public TaskStatus getTo()   { return to; }
}
