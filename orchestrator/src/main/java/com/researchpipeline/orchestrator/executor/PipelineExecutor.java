package com.researchpipeline.orchestrator.executor;

import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.StageAttempt;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.pipeline.PipelineGraph;
import com.researchpipeline.orchestrator.pipeline.StageDefinition;
import com.researchpipeline.orchestrator.retry.RetryDecision;
import com.researchpipeline.orchestrator.retry.RetryPolicy;
import com.researchpipeline.orchestrator.retry.StageFailure;
import com.researchpipeline.orchestrator.stage.StageFailureException;
import com.researchpipeline.orchestrator.stage.StageInvocation;
import com.researchpipeline.orchestrator.stage.StageRegistry;
import com.researchpipeline.orchestrator.store.TaskStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Drives a task through a {@link PipelineGraph}.
 *
 * For a given task, the executor:
 *   1. Moves it PENDING → RUNNING (or resumes a RUNNING task from its history)
 *   2. Dispatches every ready stage to the stage worker pool; independent
 *      stages run concurrently
 *   3. Appends a StageAttempt to the task store when each attempt ends, and
 *      only then lets dependent stages start
 *   4. On failure asks the stage's RetryPolicy: RETRY schedules the next
 *      attempt on the timer pool, GIVE_UP stops the run
 *   5. Completes the task with the report stage's output once every stage
 *      has succeeded
 *
 * Nothing blocks while waiting: collaborator calls run on worker threads and
 * retry delays are timers, so one task's backoff never holds up another task.
 *
 * Stopping (GIVE_UP or cancellation): no new attempt starts, pending retries
 * are dropped, attempts already in flight finish and are recorded, then the
 * task moves to FAILED or CANCELLED.
 *
 * Shutdown is different: attempts interrupted by it are not recorded and the
 * retry policy is not consulted, so the task stays RUNNING with its attempt
 * budget intact and restart recovery picks it up.
 */
public class PipelineExecutor {

    private static final Logger log = LoggerFactory.getLogger(PipelineExecutor.class);

    private final TaskStore                taskStore;
    private final StageRegistry            stageRegistry;
    private final PipelineGraph            defaultGraph;
    private final RetryPolicy              defaultRetryPolicy;
    private final Duration                 defaultTimeout;
    private final ExecutorService          stageWorkers;
    private final ScheduledExecutorService timers;
    private final MeterRegistry            meterRegistry;

    private final ConcurrentMap<UUID, TaskRun> active = new ConcurrentHashMap<>();

    private volatile boolean shuttingDown;

    public PipelineExecutor(TaskStore taskStore,
                            StageRegistry stageRegistry,
                            PipelineGraph defaultGraph,
                            RetryPolicy defaultRetryPolicy,
                            Duration defaultTimeout,
                            ExecutorService stageWorkers,
                            ScheduledExecutorService timers,
                            MeterRegistry meterRegistry) {
        this.taskStore          = taskStore;
        this.stageRegistry      = stageRegistry;
        this.defaultGraph       = defaultGraph;
        this.defaultRetryPolicy = defaultRetryPolicy;
        this.defaultTimeout     = defaultTimeout;
        this.stageWorkers       = stageWorkers;
        this.timers             = timers;
        this.meterRegistry      = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /** Run a task through the configured pipeline. */
    public CompletableFuture<TaskStatus> run(UUID taskId) {
        return run(taskId, defaultGraph);
    }

    /**
     * Start (or resume) driving a task. Returns at once; the future completes
     * with the task's final status. Calling this for a task that is already
     * being driven returns the existing run's future.
     */
    public CompletableFuture<TaskStatus> run(UUID taskId, PipelineGraph graph) {
        stageRegistry.verifyCovers(graph);

        TaskRun run = new TaskRun(taskId, graph);
        TaskRun existing = active.putIfAbsent(taskId, run);
        if (existing != null) {
            log.debug("Task {} is already running", taskId);
            return existing.result;
        }
        try {
            start(run);
        } catch (RuntimeException e) {
            active.remove(taskId);
            throw e;
        }
        return run.result;
    }

    /**
     * Cancel a PENDING or RUNNING task.
     *
     * A task being driven stops dispatching; its in-flight attempts finish and
     * are recorded before the status becomes CANCELLED. A PENDING task that
     * has not been started is cancelled immediately.
     *
     * @throws InvalidStatusTransitionException if the task is already terminal
     */
    public void cancel(UUID taskId) {
        Task task = taskStore.requestCancel(taskId);
        TaskRun run = active.get(taskId);
        if (run != null) {
            synchronized (run) {
                run.stop(TaskStatus.CANCELLED, "Cancelled on request");
                advance(run);
            }
            return;
        }
        if (task.getStatus() == TaskStatus.PENDING) {
            try {
                taskStore.fail(taskId, TaskStatus.CANCELLED, "Cancelled before start");
            } catch (InvalidStatusTransitionException e) {
                // A concurrent run() picked the task up; it sees the flag and stops itself.
                log.debug("Task {} left PENDING while cancelling: {}", taskId, e.getMessage());
            }
        }
    }

    public boolean isRunning(UUID taskId) {
        return active.containsKey(taskId);
    }

    /**
     * Stop the worker and timer pools. In-flight attempts are interrupted and
     * every active run is abandoned with its task left RUNNING.
     */
    public void shutdown() {
        log.info("Shutting down pipeline executor ({} active runs)", active.size());
        shuttingDown = true;
        timers.shutdownNow();
        stageWorkers.shutdownNow();
        for (TaskRun run : List.copyOf(active.values())) {
            synchronized (run) {
                abandon(run);
            }
        }
    }

    // ------------------------------------------------------------------
    // Run lifecycle
    // ------------------------------------------------------------------

    private void start(TaskRun run) {
        Task task = taskStore.get(run.taskId);
        synchronized (run) {
            if (run.finished) return;
            run.parameters = task.getParameters();
            switch (task.getStatus()) {
                case PENDING -> {
                    if (task.isCancelRequested()) {
                        run.stop(TaskStatus.CANCELLED, "Cancelled before start");
                    } else {
                        try {
                            taskStore.updateStatus(run.taskId, TaskStatus.RUNNING);
                        } catch (InvalidStatusTransitionException e) {
                            finishWithStoredStatus(run);
                            return;
                        }
                        log.info("Task {} RUNNING on {}", run.taskId, run.graph);
                    }
                }
                case RUNNING -> {
                    restoreFromHistory(run);
                    if (task.isCancelRequested()) {
                        run.stop(TaskStatus.CANCELLED, "Cancelled on request");
                    }
                }
                default -> {
                    log.info("Task {} is already {}; nothing to run", run.taskId, task.getStatus());
                    finishWithStoredStatus(run);
                    return;
                }
            }
            advance(run);
        }
    }

    /** Rebuild the completed set, outputs and attempt counters of a task that was RUNNING. */
    private void restoreFromHistory(TaskRun run) {
        for (StageAttempt attempt : taskStore.history(run.taskId)) {
            String stage = attempt.getStageName();
            if (!run.graph.contains(stage)) {
                log.warn("Task {} history mentions stage '{}' which is not in the pipeline", run.taskId, stage);
                continue;
            }
            run.attempts.merge(stage, attempt.getAttemptNumber(), Math::max);
            if (attempt.isSuccess()) {
                run.completed.add(stage);
                run.outputs.put(stage, attempt.getOutput());
            }
        }
        log.info("Task {} resumed: {} of {} stages already completed",
                run.taskId, run.completed.size(), run.graph.size());
    }

    /**
     * Move the run forward as far as it can go right now.
     * Caller holds the run's monitor.
     */
    private void advance(TaskRun run) {
        if (run.finished) return;

        if (run.stopping()) {
            if (run.inFlight.isEmpty()) {
                finishStopped(run);
            }
            return;
        }

        if (run.allStagesCompleted()) {
            finishCompleted(run);
            return;
        }

        List<StageDefinition> ready = run.graph.readyStages(run.completed);
        for (StageDefinition stage : ready) {
            if (run.inFlight.contains(stage.name()) || run.pendingRetries.containsKey(stage.name())) {
                continue;
            }
            launch(run, stage);
            if (run.stopping()) break;
        }

        if (!run.stopping() && run.inFlight.isEmpty() && run.pendingRetries.isEmpty()) {
            // Cannot happen for a validated graph.
            List<String> unreachable = new ArrayList<>(run.graph.stageNames());
            unreachable.removeAll(run.completed);
            run.stop(TaskStatus.FAILED, "Pipeline configuration error: stages " + unreachable + " can never run");
        }
        if (run.stopping() && run.inFlight.isEmpty()) {
            finishStopped(run);
        }
    }

    // ------------------------------------------------------------------
    // Attempts
    // ------------------------------------------------------------------

    /** Start one attempt of {@code stage}. Caller holds the run's monitor. */
    private void launch(TaskRun run, StageDefinition stage) {
        String name = stage.name();
        int attemptNumber = run.attempts.merge(name, 1, Integer::sum);
        Instant startedAt = Instant.now();
        taskStore.markStageStarted(run.taskId, name);

        StageInvocation invocation = new StageInvocation(
                run.taskId, name, attemptNumber, run.parameters, new LinkedHashMap<>(run.outputs));
        Duration timeout = stage.timeout() != null ? stage.timeout() : defaultTimeout;

        // The completion callback is registered before the work is submitted so
        // it always runs on the worker or timer thread, never inline here.
        CompletableFuture<String> attempt = new CompletableFuture<>();
        run.inFlight.add(name);
        attempt.whenComplete((output, error) ->
                onAttemptFinished(run, stage, attemptNumber, startedAt, output, error));

        Future<?> work;
        try {
            work = stageWorkers.submit(() -> {
                MDC.put("taskId",  run.taskId.toString());
                MDC.put("stage",   name);
                MDC.put("attempt", String.valueOf(attemptNumber));
                try {
                    attempt.complete(stageRegistry.invoke(invocation));
                } catch (Throwable t) {
                    attempt.completeExceptionally(t);
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            run.inFlight.remove(name);
            run.attempts.merge(name, -1, Integer::sum);
            if (shuttingDown) {
                abandon(run);
                return;
            }
            log.error("Task {}: stage worker pool rejected stage '{}'", run.taskId, name, e);
            run.stop(TaskStatus.FAILED, "Executor is shutting down; stage '" + name + "' was not started");
            return;
        }
        log.info("Task {} stage '{}' attempt {} started (timeout {})", run.taskId, name, attemptNumber, timeout);

        ScheduledFuture<?> timer = timers.schedule(() -> {
            if (attempt.completeExceptionally(new StageTimeoutException(name, timeout))) {
                work.cancel(true);
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        attempt.whenComplete((output, error) -> timer.cancel(false));
    }

    private void onAttemptFinished(TaskRun run, StageDefinition stage, int attemptNumber,
                                   Instant startedAt, String output, Throwable error) {
        synchronized (run) {
            try {
                run.inFlight.remove(stage.name());
                if (run.finished) return;
                if (shuttingDown) {
                    log.warn("Task {} stage '{}' attempt {} interrupted by shutdown; not recorded",
                            run.taskId, stage.name(), attemptNumber);
                    abandon(run);
                    return;
                }
                Instant finishedAt = Instant.now();

                if (error == null && isReportStage(run, stage) && (output == null || output.isBlank())) {
                    error = new StageFailureException("Stage '" + stage.name() + "' produced an empty report", false);
                }

                if (error == null) {
                    recordSuccess(run, stage, attemptNumber, startedAt, finishedAt, output);
                } else {
                    recordFailure(run, stage, attemptNumber, startedAt, finishedAt, unwrap(error));
                }
                advance(run);
            } catch (RuntimeException e) {
                abort(run, e);
            }
        }
    }

    private void recordSuccess(TaskRun run, StageDefinition stage, int attemptNumber,
                               Instant startedAt, Instant finishedAt, String output) {
        taskStore.appendStageAttempt(run.taskId,
                StageAttempt.success(stage.name(), attemptNumber, startedAt, finishedAt, output));
        run.completed.add(stage.name());
        run.outputs.put(stage.name(), output);
        log.info("Task {} stage '{}' attempt {} succeeded ({} of {} stages done)",
                run.taskId, stage.name(), attemptNumber, run.completed.size(), run.graph.size());
    }

    private void recordFailure(TaskRun run, StageDefinition stage, int attemptNumber,
                               Instant startedAt, Instant finishedAt, Throwable error) {
        String detail;
        boolean retryable;
        if (error instanceof StageFailureException sfe) {
            detail    = sfe.getMessage();
            retryable = sfe.isRetryable();
        } else {
            detail    = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
            retryable = false;
        }

        taskStore.appendStageAttempt(run.taskId,
                StageAttempt.failure(stage.name(), attemptNumber, startedAt, finishedAt, detail));

        if (run.stopping()) {
            log.warn("Task {} stage '{}' attempt {} failed while stopping: {}",
                    run.taskId, stage.name(), attemptNumber, detail);
            return;
        }

        RetryPolicy policy = stage.retryPolicy() != null ? stage.retryPolicy() : defaultRetryPolicy;
        RetryDecision decision = policy.decide(attemptNumber,
                new StageFailure(stage.name(), stage.idempotent(), detail, retryable));

        if (decision.shouldRetry()) {
            log.warn("Task {} stage '{}' attempt {} failed, retrying in {}: {}",
                    run.taskId, stage.name(), attemptNumber, decision.delay(), detail);
            scheduleRetry(run, stage, decision.delay());
        } else {
            log.error("Task {} stage '{}' gave up after attempt {}: {}",
                    run.taskId, stage.name(), attemptNumber, detail);
            run.stop(TaskStatus.FAILED,
                    "Stage '" + stage.name() + "' failed after " + attemptNumber + " attempt(s): " + detail);
        }
    }

    /** Caller holds the run's monitor. */
    private void scheduleRetry(TaskRun run, StageDefinition stage, Duration delay) {
        ScheduledFuture<?> retry = timers.schedule(() -> {
            synchronized (run) {
                try {
                    if (run.pendingRetries.remove(stage.name()) == null) {
                        return;   // dropped by stop()
                    }
                    if (!run.stopping() && !run.finished) {
                        launch(run, stage);
                    }
                    advance(run);
                } catch (RuntimeException e) {
                    abort(run, e);
                }
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        run.pendingRetries.put(stage.name(), retry);
    }

    // ------------------------------------------------------------------
    // Terminal transitions
    // ------------------------------------------------------------------

    private void finishCompleted(TaskRun run) {
        String reportStage = run.graph.reportStage().name();
        taskStore.complete(run.taskId, run.outputs.get(reportStage));
        finish(run, TaskStatus.COMPLETED);
    }

    private void finishStopped(TaskRun run) {
        try {
            taskStore.fail(run.taskId, run.stopStatus, run.stopMessage);
            finish(run, run.stopStatus);
        } catch (InvalidStatusTransitionException e) {
            log.warn("Task {} could not move to {}: {}", run.taskId, run.stopStatus, e.getMessage());
            finishWithStoredStatus(run);
        }
    }

    private void finishWithStoredStatus(TaskRun run) {
        finish(run, taskStore.get(run.taskId).getStatus());
    }

    private void finish(TaskRun run, TaskStatus status) {
        run.finished = true;
        active.remove(run.taskId, run);
        meterRegistry.counter("pipeline.task.finished", "status", status.name()).increment();
        log.info("Task {} finished with status {}", run.taskId, status);
        run.result.complete(status);
    }

    /**
     * The task store could not be written. The run is abandoned; the task
     * stays RUNNING and is picked up again by restart recovery.
     */
    private void abort(TaskRun run, RuntimeException e) {
        log.error("Task {} aborted: task store update failed: {}", run.taskId, e.getMessage(), e);
        run.stop(TaskStatus.FAILED, "Task store update failed: " + e.getMessage());
        run.finished = true;
        active.remove(run.taskId, run);
        run.result.completeExceptionally(e);
    }

    /**
     * Drop the run without touching the task store. Caller holds the run's
     * monitor.
     */
    private void abandon(TaskRun run) {
        if (run.finished) return;
        run.finished = true;
        run.pendingRetries.values().forEach(f -> f.cancel(false));
        run.pendingRetries.clear();
        active.remove(run.taskId, run);
        log.info("Task {} abandoned by shutdown; left RUNNING", run.taskId);
        run.result.completeExceptionally(new ExecutorShutdownException(run.taskId));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static boolean isReportStage(TaskRun run, StageDefinition stage) {
        return run.graph.reportStage().name().equals(stage.name());
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
