package com.researchpipeline.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one pipeline run.
 *
 * Transitions:
 *   PENDING        → RUNNING | FAILED | CANCELLED          (executor)
 *   RUNNING        → COMPLETED | FAILED | CANCELLED        (executor)
 *   COMPLETED      → PENDING_REVIEW | APPROVED | REJECTED  (reviewer)
 *   PENDING_REVIEW → APPROVED | REJECTED                   (reviewer)
 *
 * A report exists exactly in COMPLETED, PENDING_REVIEW and APPROVED.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    PENDING_REVIEW,
    APPROVED,
    REJECTED,
    CANCELLED;

    private static final Set<TaskStatus> REPORT_BEARING =
            EnumSet.of(COMPLETED, PENDING_REVIEW, APPROVED);

    /** True for the statuses that carry a report. */
    public boolean hasReport() {
        return REPORT_BEARING.contains(this);
    }

    /** True once the executor can no longer move the task. */
    public boolean isTerminalForExecutor() {
        return this != PENDING && this != RUNNING;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return switch (this) {
            case PENDING        -> next == RUNNING || next == FAILED || next == CANCELLED;
            case RUNNING        -> next == COMPLETED || next == FAILED || next == CANCELLED;
            case COMPLETED      -> next == PENDING_REVIEW || next == APPROVED || next == REJECTED;
            case PENDING_REVIEW -> next == APPROVED || next == REJECTED;
            case FAILED, APPROVED, REJECTED, CANCELLED -> false;
        };
    }
}
