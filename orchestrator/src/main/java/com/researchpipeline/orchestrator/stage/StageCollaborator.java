package com.researchpipeline.orchestrator.stage;

/**
 * The external unit of work behind a stage: a document source connector, a
 * text extractor, an embedding/index client, a report generator.
 *
 * Implementations declared as Spring {@code @Component}s are picked up by the
 * {@link StageRegistry}; collaborators configured with an HTTP endpoint are
 * created by the pipeline configuration.
 */
public interface StageCollaborator {

    /** Stage name this collaborator serves; must match a stage of the pipeline. */
    String name();

    /**
     * Run one attempt.
     *
     * @return the stage output, passed to downstream stages (the report stage's
     *         output becomes the task report)
     * @throws StageFailureException to fail the attempt; set {@code retryable}
     *         when no side effect was committed. Any other exception fails the
     *         attempt as not retryable.
     */
    String invoke(StageInvocation invocation) throws StageFailureException;
}
