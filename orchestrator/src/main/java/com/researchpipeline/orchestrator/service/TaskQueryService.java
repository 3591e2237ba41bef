package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import com.researchpipeline.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only view of the task store for API clients.
 *
 * Status filters are plain strings matched case-insensitively against the
 * status names ("completed", "Pending_Review", ...). A null or empty filter
 * selects every task; names that match no status select nothing. A FAILED
 * task is data like any other: it is listed with its status and error
 * message, never raised as an error.
 */
@Service
@Transactional(readOnly = true)
public class TaskQueryService {

    private static final Logger log = LoggerFactory.getLogger(TaskQueryService.class);

    private final TaskStore taskStore;

    public TaskQueryService(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    /** All tasks matching the filter, newest first. */
    public List<TaskSummary> listTasks(Collection<String> statusFilter) {
        if (isUnfiltered(statusFilter)) {
            return summaries(taskStore.listByStatus(Set.of()));
        }
        Set<TaskStatus> statuses = resolve(statusFilter);
        if (statuses.isEmpty()) return List.of();
        return summaries(taskStore.listByStatus(statuses));
    }

    /** One window of {@link #listTasks(Collection)}. */
    public List<TaskSummary> listTasks(Collection<String> statusFilter, int offset, int limit) {
        if (isUnfiltered(statusFilter)) {
            return summaries(taskStore.listByStatus(Set.of(), offset, limit));
        }
        Set<TaskStatus> statuses = resolve(statusFilter);
        if (statuses.isEmpty()) return List.of();
        return summaries(taskStore.listByStatus(statuses, offset, limit));
    }

    /**
     * @throws TaskNotFoundException if no task has this id
     */
    public TaskDetail getTask(UUID taskId) {
        Task task = taskStore.get(taskId);
        return TaskDetail.from(task, taskStore.history(taskId));
    }

    /**
     * The generated report of a COMPLETED, PENDING_REVIEW or APPROVED task.
     *
     * @throws TaskNotFoundException    if no task has this id
     * @throws ReportNotReadyException  if the task has not produced a report
     */
    public TaskReport getReport(UUID taskId) {
        Task task = taskStore.get(taskId);
        if (!task.getStatus().hasReport()) {
            throw new ReportNotReadyException(taskId, task.getStatus());
        }
        return new TaskReport(taskId, task.getStatus(), task.getReport());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean isUnfiltered(Collection<String> filter) {
        return filter == null || filter.stream().allMatch(s -> s == null || s.isBlank());
    }

    private static Set<TaskStatus> resolve(Collection<String> filter) {
        Set<TaskStatus> statuses = EnumSet.noneOf(TaskStatus.class);
        for (String raw : filter) {
            if (raw == null || raw.isBlank()) continue;
            String wanted = raw.trim().toUpperCase(Locale.ROOT);
            boolean matched = false;
            for (TaskStatus status : TaskStatus.values()) {
                if (status.name().equals(wanted)) {
                    statuses.add(status);
                    matched = true;
                }
            }
            if (!matched) {
                log.debug("Status filter '{}' matches no task status", raw);
            }
        }
        return statuses;
    }

    private static List<TaskSummary> summaries(List<Task> tasks) {
        return tasks.stream().map(TaskSummary::from).toList();
    }
}
