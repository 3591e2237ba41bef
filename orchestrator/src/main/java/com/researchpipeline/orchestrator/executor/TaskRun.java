package com.researchpipeline.orchestrator.executor;

import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.pipeline.PipelineGraph;

import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory progress of one task while the executor drives it.
 *
 * Guarded by its own monitor: every read or write happens inside
 * {@code synchronized (run)}. The durable copy lives in the task store.
 */
final class TaskRun {

    final UUID          taskId;
    final PipelineGraph graph;
    final CompletableFuture<TaskStatus> result = new CompletableFuture<>();

    Map<String, Object> parameters = Map.of();

    final Set<String>         completed = new HashSet<>();
    final Map<String, String> outputs   = new LinkedHashMap<>();
    final Map<String, Integer> attempts = new HashMap<>();
    final Set<String>         inFlight  = new HashSet<>();
    final Map<String, ScheduledFuture<?>> pendingRetries = new HashMap<>();

    // Set once the run must stop dispatching; the task turns to stopStatus
    // when nothing is in flight any more.
    TaskStatus stopStatus;
    String     stopMessage;

    boolean finished;

    TaskRun(UUID taskId, PipelineGraph graph) {
        this.taskId = taskId;
        this.graph  = graph;
    }

    boolean stopping() {
        return stopStatus != null;
    }

    /** First stop wins: a cancellation does not overwrite an earlier failure and vice versa. */
    void stop(TaskStatus status, String message) {
        if (stopStatus == null) {
            stopStatus  = status;
            stopMessage = message;
        }
        pendingRetries.values().forEach(f -> f.cancel(false));
        pendingRetries.clear();
    }

    boolean allStagesCompleted() {
        return completed.size() == graph.size();
    }
}
