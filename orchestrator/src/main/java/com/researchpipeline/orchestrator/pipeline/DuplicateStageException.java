package com.researchpipeline.orchestrator.pipeline;

public class DuplicateStageException extends PipelineConfigurationException {

    public DuplicateStageException(String stage) {
        super("Stage '" + stage + "' is defined more than once");
    }
}
