package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.executor.PipelineExecutor;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;

/**
 * Picks up runs that were interrupted by a restart.
 *
 * PENDING tasks are started, RUNNING tasks are resumed from their stage
 * history: stages with a successful attempt are not run again, the others
 * run with their attempt numbers continuing where they stopped. Oldest tasks
 * go first.
 */
@Component
public class TaskRecovery {

    private static final Logger log = LoggerFactory.getLogger(TaskRecovery.class);

    private final TaskStore        taskStore;
    private final PipelineExecutor executor;
    private final boolean          enabled;

    public TaskRecovery(TaskStore taskStore,
                        PipelineExecutor executor,
                        @Value("${pipeline.recovery.enabled:true}") boolean enabled) {
        this.taskStore = taskStore;
        this.executor  = executor;
        this.enabled   = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    /** @return how many runs were restarted */
    public int recover() {
        if (!enabled) {
            log.info("Task recovery disabled");
            return 0;
        }
        List<Task> unfinished = taskStore.listByStatus(EnumSet.of(TaskStatus.PENDING, TaskStatus.RUNNING))
                .stream()
                .sorted(Comparator.comparing(Task::getCreatedAt))
                .toList();

        int restarted = 0;
        for (Task task : unfinished) {
            try {
                executor.run(task.getId());
                restarted++;
                log.info("Recovered task {} (was {})", task.getId(), task.getStatus());
            } catch (RuntimeException e) {
                log.error("Could not recover task {}: {}", task.getId(), e.getMessage(), e);
            }
        }
        if (restarted > 0) {
            log.info("Recovered {} unfinished task(s)", restarted);
        }
        return restarted;
    }
}
