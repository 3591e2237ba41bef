package com.researchpipeline.orchestrator.retry;

/**
 * Decides whether a failed stage attempt is tried again.
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attemptNumber the attempt that just failed, starting at 1
     * @param failure       what went wrong
     * @return RETRY with the delay before the next attempt, or GIVE_UP
     */
    RetryDecision decide(int attemptNumber, StageFailure failure);
}
