package com.researchpipeline.orchestrator.retry;

import java.time.Duration;

/**
 * Base for policies that allow at most {@code maxAttempts} attempts in total.
 *
 * A non-idempotent stage is retried only when its failure is flagged
 * retryable; otherwise the policy gives up on the first failure, whatever the
 * attempt count.
 */
public abstract class BoundedRetryPolicy implements RetryPolicy {

    private final int maxAttempts;

    protected BoundedRetryPolicy(int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        this.maxAttempts = maxAttempts;
    }

    @Override
    public final RetryDecision decide(int attemptNumber, StageFailure failure) {
        if (!failure.idempotentStage() && !failure.retryable()) {
            return RetryDecision.giveUp();
        }
        if (attemptNumber >= maxAttempts) {
            return RetryDecision.giveUp();
        }
        return RetryDecision.retry(delayAfter(attemptNumber));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /** Delay before the attempt that follows {@code attemptNumber}. */
    protected abstract Duration delayAfter(int attemptNumber);
}
