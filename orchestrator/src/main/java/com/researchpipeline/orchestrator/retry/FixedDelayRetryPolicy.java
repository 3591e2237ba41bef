package com.researchpipeline.orchestrator.retry;

import java.time.Duration;

/**
 * Same delay before every retry.
 */
public class FixedDelayRetryPolicy extends BoundedRetryPolicy {

    private final Duration delay;

    public FixedDelayRetryPolicy(int maxAttempts, Duration delay) {
        super(maxAttempts);
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        this.delay = delay;
    }

    @Override
    protected Duration delayAfter(int attemptNumber) {
        return delay;
    }

    @Override
    public String toString() {
        return "FixedDelayRetryPolicy[maxAttempts=" + getMaxAttempts() + ", delay=" + delay + "]";
    }
}
