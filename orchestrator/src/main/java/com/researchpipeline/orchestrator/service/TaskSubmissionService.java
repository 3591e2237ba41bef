package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.executor.ExecutorShutdownException;
import com.researchpipeline.orchestrator.executor.PipelineExecutor;
import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import com.researchpipeline.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for starting and cancelling pipeline runs.
 */
@Service
public class TaskSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(TaskSubmissionService.class);

    private final TaskStore        taskStore;
    private final PipelineExecutor executor;

    public TaskSubmissionService(TaskStore taskStore, PipelineExecutor executor) {
        this.taskStore = taskStore;
        this.executor  = executor;
    }

    /**
     * Create a PENDING task and hand it to the executor. Returns as soon as
     * the run has been started; poll the task for progress.
     */
    public Task submit(String query, Map<String, Object> parameters) {
        Task task = taskStore.create(query, parameters);
        executor.run(task.getId()).whenComplete((status, error) -> {
            if (error instanceof ExecutorShutdownException) {
                log.info("Run of task {} interrupted by shutdown; recovery resumes it", task.getId());
            } else if (error != null) {
                log.error("Run of task {} ended abnormally: {}", task.getId(), error.getMessage(), error);
            }
        });
        return task;
    }

    /**
     * @throws TaskNotFoundException            if no task has this id
     * @throws InvalidStatusTransitionException if the task already finished
     */
    public Task cancel(UUID taskId) {
        executor.cancel(taskId);
        return taskStore.get(taskId);
    }
}
