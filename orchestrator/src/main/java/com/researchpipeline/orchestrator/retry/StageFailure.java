package com.researchpipeline.orchestrator.retry;

/**
 * A failed stage attempt as seen by a {@link RetryPolicy}.
 *
 * @param stageName       the stage that failed
 * @param idempotentStage whether the stage may be re-run without duplicating side effects
 * @param detail          error message recorded in the stage history
 * @param retryable       the stage reported the failure as safe to retry
 *                        (no side effect was committed)
 */
public record StageFailure(String stageName, boolean idempotentStage, String detail, boolean retryable) {}
