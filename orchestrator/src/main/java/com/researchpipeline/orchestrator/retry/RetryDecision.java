package com.researchpipeline.orchestrator.retry;

import java.time.Duration;

/**
 * What the executor should do after a failed attempt.
 *
 * @param action RETRY or GIVE_UP
 * @param delay  wait before the next attempt; {@link Duration#ZERO} for GIVE_UP
 */
public record RetryDecision(Action action, Duration delay) {

    public enum Action { RETRY, GIVE_UP }

    private static final RetryDecision GIVE_UP = new RetryDecision(Action.GIVE_UP, Duration.ZERO);

    public RetryDecision {
        if (action == null) throw new IllegalArgumentException("action must not be null");
        if (delay == null || delay.isNegative()) throw new IllegalArgumentException("delay must be >= 0");
    }

    public static RetryDecision retry(Duration delay) {
        return new RetryDecision(Action.RETRY, delay);
    }

    public static RetryDecision giveUp() {
        return GIVE_UP;
    }

    public boolean shouldRetry() {
        return action == Action.RETRY;
    }
}
