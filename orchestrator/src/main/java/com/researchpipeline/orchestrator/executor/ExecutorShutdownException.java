package com.researchpipeline.orchestrator.executor;

import java.util.UUID;

/**
 * A run abandoned because the executor shut down. The task stays RUNNING
 * and restart recovery resumes it from its history.
 */
public class ExecutorShutdownException extends RuntimeException {

    ExecutorShutdownException(UUID taskId) {
        super("Executor shut down; task " + taskId + " left RUNNING for recovery");
    }
}
