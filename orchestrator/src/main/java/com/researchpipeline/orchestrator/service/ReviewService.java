package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import com.researchpipeline.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Human review of generated reports.
 *
 * These transitions belong to a reviewer, never to the executor:
 *   COMPLETED      → PENDING_REVIEW   (flag for review)
 *   COMPLETED      → APPROVED         (approve without review round)
 *   PENDING_REVIEW → APPROVED         (approve, optionally with an edited report)
 *   COMPLETED | PENDING_REVIEW → REJECTED, followed by a fresh run
 *
 * Every method throws {@link TaskNotFoundException} for unknown ids and
 * {@link InvalidStatusTransitionException} when the task is in the wrong state.
 */
@Service
public class ReviewService {

    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    /** Parameter keys added to the run that regenerates a rejected report. */
    public static final String REGENERATION_OF  = "regenerationOf";
    public static final String REJECTION_REASON = "rejectionReason";

    private final TaskStore             taskStore;
    private final TaskSubmissionService submissionService;

    public ReviewService(TaskStore taskStore, TaskSubmissionService submissionService) {
        this.taskStore         = taskStore;
        this.submissionService = submissionService;
    }

    @Transactional
    public Task requestReview(UUID taskId) {
        Task task = taskStore.updateStatus(taskId, TaskStatus.PENDING_REVIEW);
        log.info("Task {} flagged for review", taskId);
        return task;
    }

    @Transactional
    public Task approve(UUID taskId) {
        Task task = taskStore.updateStatus(taskId, TaskStatus.APPROVED);
        log.info("Task {} approved", taskId);
        return task;
    }

    /** Replace the report of a task under review and approve it. */
    public Task edit(UUID taskId, String editedReport) {
        Task task = taskStore.editAndApprove(taskId, editedReport);
        log.info("Task {} approved with an edited report", taskId);
        return task;
    }

    /**
     * Reject the report and submit a new run with the same query and
     * parameters. The rejected task keeps the reason as its error message;
     * the new run sees the reason and the rejected task's id in its
     * parameters.
     *
     * @return the newly submitted task
     */
    public Task reject(UUID taskId, String reason) {
        Task rejected = taskStore.reject(taskId, reason);

        Map<String, Object> parameters = new LinkedHashMap<>(rejected.getParameters());
        parameters.put(REGENERATION_OF,  taskId.toString());
        parameters.put(REJECTION_REASON, reason);
        Task regenerated = submissionService.submit(rejected.getQuery(), parameters);

        log.info("Task {} rejected; regenerating as task {}", taskId, regenerated.getId());
        return regenerated;
    }
}
