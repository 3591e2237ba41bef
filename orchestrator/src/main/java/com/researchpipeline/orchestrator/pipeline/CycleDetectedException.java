package com.researchpipeline.orchestrator.pipeline;

import java.util.List;

public class CycleDetectedException extends PipelineConfigurationException {

    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Stage dependencies contain a cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** The stages on the cycle; the first name is repeated at the end. */
    public List<String> getCycle() { return cycle; }
}
