package com.researchpipeline.orchestrator.stage;

import com.researchpipeline.orchestrator.pipeline.PipelineConfigurationException;
import com.researchpipeline.orchestrator.pipeline.PipelineGraph;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process registry of stage collaborators.
 *
 * <ol>
 *   <li>Lookup by stage name ({@link #get}).</li>
 *   <li>Metrics-instrumented invocation ({@link #invoke}): every call is
 *       timed and counted, with no per-collaborator boilerplate.</li>
 *   <li>Startup check that a pipeline has a collaborator for every stage
 *       ({@link #verifyCovers}).</li>
 * </ol>
 */
public class StageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StageRegistry.class);

    private final Map<String, StageCollaborator> collaborators = new ConcurrentHashMap<>();
    private final MeterRegistry meterRegistry;

    public StageRegistry(List<StageCollaborator> all, MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        for (StageCollaborator collaborator : all) {
            StageCollaborator previous = collaborators.put(collaborator.name(), collaborator);
            if (previous != null) {
                throw new PipelineConfigurationException(
                        "Two collaborators registered for stage '" + collaborator.name() + "'");
            }
            log.info("Registered stage collaborator '{}' ({})",
                    collaborator.name(), collaborator.getClass().getSimpleName());
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public StageCollaborator get(String name) {
        StageCollaborator collaborator = collaborators.get(name);
        if (collaborator == null) {
            throw new StageCollaboratorNotFoundException(name);
        }
        return collaborator;
    }

    /** Registered stage names (sorted). */
    public List<String> stageNames() {
        return collaborators.keySet().stream().sorted().toList();
    }

    /**
     * @throws PipelineConfigurationException if a stage of {@code graph} has no collaborator
     */
    public void verifyCovers(PipelineGraph graph) {
        List<String> missing = graph.stageNames().stream()
                .filter(name -> !collaborators.containsKey(name))
                .toList();
        if (!missing.isEmpty()) {
            throw new PipelineConfigurationException("No collaborator registered for stages " + missing);
        }
    }

    // ------------------------------------------------------------------
    // Metrics-instrumented invocation
    // ------------------------------------------------------------------

    /**
     * Invoke the collaborator of {@code invocation.stageName()}.
     *
     * <pre>
     *   pipeline.stage.calls{stage, outcome="success|failure|retryable_failure"}
     *   pipeline.stage.duration{stage}
     * </pre>
     *
     * @throws StageFailureException for any fault of the collaborator; the
     *         message is the fault's own message
     */
    public String invoke(StageInvocation invocation) {
        String stage = invocation.stageName();
        StageCollaborator collaborator = get(stage);

        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "success";
        try {
            return collaborator.invoke(invocation);
        } catch (StageFailureException e) {
            outcome = e.isRetryable() ? "retryable_failure" : "failure";
            throw e;
        } catch (Exception e) {
            outcome = "failure";
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            throw new StageFailureException(message, false, e);
        } finally {
            sample.stop(meterRegistry.timer("pipeline.stage.duration", "stage", stage));
            meterRegistry.counter("pipeline.stage.calls", "stage", stage, "outcome", outcome).increment();
        }
    }
}
