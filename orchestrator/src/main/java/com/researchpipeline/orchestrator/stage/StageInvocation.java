package com.researchpipeline.orchestrator.stage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Everything a stage collaborator receives for one attempt.
 *
 * @param taskId        the run this attempt belongs to
 * @param stageName     the stage being run
 * @param attemptNumber 1 for the first attempt of this stage
 * @param parameters    the task's run parameters, unchanged
 * @param priorOutputs  outputs of the stages that already succeeded, keyed by stage name
 */
public record StageInvocation(
        UUID                taskId,
        String              stageName,
        int                 attemptNumber,
        Map<String, Object> parameters,
        Map<String, String> priorOutputs) {

    public StageInvocation {
        // Values may be null (JSON nulls, stages without output), so no Map.copyOf.
        parameters   = parameters   == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        priorOutputs = priorOutputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(priorOutputs));
    }
}
