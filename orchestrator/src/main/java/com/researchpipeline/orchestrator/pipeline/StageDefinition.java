package com.researchpipeline.orchestrator.pipeline;

import com.researchpipeline.orchestrator.retry.RetryPolicy;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One named unit of work in a pipeline.
 *
 * @param name        unique within a graph; also the key of the stage's collaborator
 * @param dependsOn   stages that must succeed before this one starts
 * @param idempotent  whether re-running after a failure is safe
 * @param timeout     per-attempt limit; null means the process default
 * @param retryPolicy stage override; null means the process default
 */
public record StageDefinition(
        String      name,
        Set<String> dependsOn,
        boolean     idempotent,
        Duration    timeout,
        RetryPolicy retryPolicy) {

    public StageDefinition {
        if (name == null || name.isBlank()) {
            throw new PipelineConfigurationException("Stage name must not be blank");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new PipelineConfigurationException("Stage '" + name + "' timeout must be positive");
        }
        dependsOn = dependsOn == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }

    /** An idempotent stage with process-default timeout and retry policy. */
    public static StageDefinition of(String name, String... dependsOn) {
        return new StageDefinition(name, new LinkedHashSet<>(List.of(dependsOn)), true, null, null);
    }

    public StageDefinition withIdempotent(boolean value) {
        return new StageDefinition(name, dependsOn, value, timeout, retryPolicy);
    }

    public StageDefinition withTimeout(Duration value) {
        return new StageDefinition(name, dependsOn, idempotent, value, retryPolicy);
    }

    public StageDefinition withRetryPolicy(RetryPolicy value) {
        return new StageDefinition(name, dependsOn, idempotent, timeout, value);
    }
}
