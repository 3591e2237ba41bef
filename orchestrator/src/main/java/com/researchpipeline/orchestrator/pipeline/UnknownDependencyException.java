package com.researchpipeline.orchestrator.pipeline;

public class UnknownDependencyException extends PipelineConfigurationException {

    public UnknownDependencyException(String stage, String missing) {
        super("Stage '" + stage + "' depends on undefined stage '" + missing + "'");
    }
}
