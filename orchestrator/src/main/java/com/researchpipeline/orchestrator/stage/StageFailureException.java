package com.researchpipeline.orchestrator.stage;

/**
 * A failed stage attempt.
 *
 * {@code retryable} tells the retry policy that the stage committed no side
 * effect, so even a non-idempotent stage may run again.
 */
public class StageFailureException extends RuntimeException {

    private final boolean retryable;

    public StageFailureException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public StageFailureException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() { return retryable; }
}
