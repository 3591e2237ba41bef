package com.researchpipeline.orchestrator.pipeline;

/**
 * A malformed pipeline definition. Raised while the application starts and
 * never retried.
 */
public class PipelineConfigurationException extends RuntimeException {

    public PipelineConfigurationException(String message) {
        super(message);
    }
}
