package com.researchpipeline.orchestrator.retry;

import java.time.Duration;

/**
 * Delay grows by {@code multiplier} after every failed attempt, capped at {@code maxDelay}:
 * initialDelay, initialDelay * multiplier, initialDelay * multiplier^2, ...
 */
public class ExponentialBackoffRetryPolicy extends BoundedRetryPolicy {

    private final Duration initialDelay;
    private final double   multiplier;
    private final Duration maxDelay;

    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration initialDelay,
                                         double multiplier, Duration maxDelay) {
        super(maxAttempts);
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= initialDelay");
        }
        this.initialDelay = initialDelay;
        this.multiplier   = multiplier;
        this.maxDelay     = maxDelay;
    }

    @Override
    protected Duration delayAfter(int attemptNumber) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, attemptNumber - 1));
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    @Override
    public String toString() {
        return "ExponentialBackoffRetryPolicy[maxAttempts=" + getMaxAttempts()
                + ", initialDelay=" + initialDelay + ", multiplier=" + multiplier
                + ", maxDelay=" + maxDelay + "]";
    }
}
