package com.researchpipeline.orchestrator.store;

import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.StageAttempt;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.repository.StageAttemptRepository;
import com.researchpipeline.orchestrator.repository.TaskRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * {@link TaskStore} backed by the tasks / stage_attempts tables.
 *
 * Every mutating method is @Transactional and starts with
 * {@link TaskRepository#findByIdForUpdate}, so the row lock is held from the
 * read until the UPDATE commits.
 */
@Service
public class JpaTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JpaTaskStore.class);

    private final TaskRepository         taskRepo;
    private final StageAttemptRepository attemptRepo;
    private final EntityManager          entityManager;

    public JpaTaskStore(TaskRepository taskRepo,
                        StageAttemptRepository attemptRepo,
                        EntityManager entityManager) {
        this.taskRepo      = taskRepo;
        this.attemptRepo   = attemptRepo;
        this.entityManager = entityManager;
    }

    // ------------------------------------------------------------------
    // Creation and lookup
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Task create(String query, Map<String, Object> parameters) {
        Task task = taskRepo.save(new Task(query, parameters));
        log.info("Created task {} (query={})", task.getId(), abbreviate(query));
        return task;
    }

    @Override
    @Transactional(readOnly = true)
    public Task get(UUID taskId) {
        return taskRepo.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<StageAttempt> history(UUID taskId) {
        if (!taskRepo.existsById(taskId)) {
            throw new TaskNotFoundException(taskId);
        }
        return attemptRepo.findByTaskIdOrderBySequenceAsc(taskId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> listByStatus(Set<TaskStatus> statuses) {
        if (statuses == null || statuses.isEmpty()) {
            return taskRepo.findAllByOrderByCreatedAtDescIdAsc();
        }
        return taskRepo.findByStatusInOrderByCreatedAtDescIdAsc(statuses);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Task> listByStatus(Set<TaskStatus> statuses, int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("offset must be >= 0 and limit > 0");
        }
        boolean all = statuses == null || statuses.isEmpty();
        String jpql = all
                ? "SELECT t FROM Task t ORDER BY t.createdAt DESC, t.id ASC"
                : "SELECT t FROM Task t WHERE t.status IN :statuses ORDER BY t.createdAt DESC, t.id ASC";
        TypedQuery<Task> query = entityManager.createQuery(jpql, Task.class);
        if (!all) {
            query.setParameter("statuses", statuses);
        }
        return query.setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    // ------------------------------------------------------------------
    // Mutations (row-locked)
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public StageAttempt appendStageAttempt(UUID taskId, StageAttempt attempt) {
        Task task = lock(taskId);
        int position = (int) attemptRepo.countByTaskId(taskId) + 1;
        attempt.attachTo(task, position);
        task.touch();
        StageAttempt saved = attemptRepo.save(attempt);
        log.debug("Task {} history #{}: stage={} attempt={} outcome={}",
                taskId, position, attempt.getStageName(), attempt.getAttemptNumber(), attempt.getOutcome());
        return saved;
    }

    @Override
    @Transactional
    public Task updateStatus(UUID taskId, TaskStatus newStatus) {
        Task task = lock(taskId);
        TaskStatus previous = task.getStatus();
        task.transitionTo(newStatus);
        log.info("Task {} {} → {}", taskId, previous, newStatus);
        return taskRepo.save(task);
    }

    @Override
    @Transactional
    public Task setReport(UUID taskId, String report) {
        Task task = lock(taskId);
        task.replaceReport(report);
        log.info("Task {} report replaced ({} chars)", taskId, report.length());
        return taskRepo.save(task);
    }

    @Override
    @Transactional
    public Task editAndApprove(UUID taskId, String report) {
        Task task = lock(taskId);
        if (task.getStatus() != TaskStatus.PENDING_REVIEW) {
            throw new InvalidStatusTransitionException(taskId,
                    "only a " + TaskStatus.PENDING_REVIEW + " task can be edited, this one is " + task.getStatus());
        }
        task.replaceReport(report);
        task.transitionTo(TaskStatus.APPROVED);
        log.info("Task {} PENDING_REVIEW → APPROVED with an edited report ({} chars)", taskId, report.length());
        return taskRepo.save(task);
    }

    @Override
    @Transactional
    public Task reject(UUID taskId, String reason) {
        Task task = lock(taskId);
        TaskStatus previous = task.getStatus();
        task.reject(reason);
        log.info("Task {} {} → REJECTED: {}", taskId, previous, reason);
        return taskRepo.save(task);
    }

    @Override
    @Transactional
    public Task complete(UUID taskId, String report) {
        Task task = lock(taskId);
        task.complete(report);
        log.info("Task {} COMPLETED ({} chars of report)", taskId, report.length());
        return taskRepo.save(task);
    }

    @Override
    @Transactional
    public Task fail(UUID taskId, TaskStatus terminalStatus, String message) {
        Task task = lock(taskId);
        task.fail(terminalStatus, message);
        log.warn("Task {} {}: {}", taskId, terminalStatus, message);
        return taskRepo.save(task);
    }

    @Override
    @Transactional
    public void markStageStarted(UUID taskId, String stageName) {
        Task task = lock(taskId);
        task.setCurrentStage(stageName);
        taskRepo.save(task);
    }

    @Override
    @Transactional
    public Task requestCancel(UUID taskId) {
        Task task = lock(taskId);
        if (task.getStatus().isTerminalForExecutor()) {
            throw new InvalidStatusTransitionException(taskId,
                    "cannot cancel a task that is already " + task.getStatus());
        }
        task.setCancelRequested(true);
        task.touch();
        log.info("Task {} cancellation requested", taskId);
        return taskRepo.save(task);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Task lock(UUID taskId) {
        return taskRepo.findByIdForUpdate(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    private static String abbreviate(String text) {
        if (text == null) return null;
        return text.length() <= 50 ? text : text.substring(0, 50) + "...";
    }
}
