package com.researchpipeline.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchpipeline.orchestrator.pipeline.CycleDetectedException;
import com.researchpipeline.orchestrator.pipeline.PipelineConfigurationException;
import com.researchpipeline.orchestrator.pipeline.PipelineGraph;
import com.researchpipeline.orchestrator.retry.ExponentialBackoffRetryPolicy;
import com.researchpipeline.orchestrator.retry.FixedDelayRetryPolicy;
import com.researchpipeline.orchestrator.retry.RetryPolicy;
import com.researchpipeline.orchestrator.retry.StageFailure;
import com.researchpipeline.orchestrator.stage.StageCollaborator;
import com.researchpipeline.orchestrator.stage.StageRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Bean methods of PipelineConfig called directly with hand-built properties.
 */
class PipelineConfigTest {

    private final PipelineConfig config = new PipelineConfig();

    @Test
    void pipelineGraph_buildsStagesInDeclarationOrder() {
        PipelineProperties props = properties();

        PipelineGraph graph = config.pipelineGraph(props);

        assertThat(graph.stageNames()).containsExactly("ingest", "process", "embed-index");
        assertThat(graph.stage("embed-index").idempotent()).isFalse();
        assertThat(graph.stage("process").timeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(graph.reportStage().name()).isEqualTo("embed-index");
    }

    @Test
    void pipelineGraph_stageRetryOverride_becomesStagePolicy() {
        PipelineProperties props = properties();
        props.getStages().get(0).setMaxAttempts(4);

        PipelineGraph graph = config.pipelineGraph(props);

        RetryPolicy policy = graph.stage("ingest").retryPolicy();
        assertThat(policy).isInstanceOf(FixedDelayRetryPolicy.class);
        assertThat(((FixedDelayRetryPolicy) policy).getMaxAttempts()).isEqualTo(4);
        assertThat(graph.stage("process").retryPolicy()).isNull();
    }

    @Test
    void pipelineGraph_cycle_failsStartup() {
        PipelineProperties props = properties();
        props.getStages().get(0).setDependsOn(List.of("embed-index"));

        assertThatThrownBy(() -> config.pipelineGraph(props))
                .isInstanceOf(CycleDetectedException.class);
    }

    @Test
    void defaultRetryPolicy_exponential() {
        PipelineProperties props = properties();
        props.getRetry().setBackoff(PipelineProperties.Backoff.EXPONENTIAL);
        props.getRetry().setMaxAttempts(3);
        props.getRetry().setDelay(Duration.ofSeconds(10));

        RetryPolicy policy = config.defaultRetryPolicy(props);

        assertThat(policy).isInstanceOf(ExponentialBackoffRetryPolicy.class);
        assertThat(policy.decide(2, new StageFailure("ingest", true, "x", false)).delay())
                .isEqualTo(Duration.ofSeconds(20));
    }

    @Test
    void stageRegistry_createsHttpCollaboratorsForEndpoints() {
        PipelineProperties props = properties();

        StageRegistry registry = config.stageRegistry(props, config.pipelineGraph(props),
                noBeans(), new ObjectMapper(), new SimpleMeterRegistry());

        assertThat(registry.stageNames()).containsExactlyInAnyOrder("ingest", "process", "embed-index");
    }

    @Test
    void stageRegistry_stageWithoutCollaborator_failsStartup() {
        PipelineProperties props = properties();
        props.getStages().get(1).setEndpoint(null);

        assertThatThrownBy(() -> config.stageRegistry(props, config.pipelineGraph(props),
                noBeans(), new ObjectMapper(), new SimpleMeterRegistry()))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining("process");
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<StageCollaborator> noBeans() {
        ObjectProvider<StageCollaborator> provider = mock(ObjectProvider.class);
        when(provider.orderedStream()).thenReturn(Stream.empty());
        return provider;
    }

    private static PipelineProperties properties() {
        PipelineProperties props = new PipelineProperties();
        props.getRetry().setDelay(Duration.ZERO);
        props.setStages(new ArrayList<>(List.of(
                stage("ingest", List.of(), true, null),
                stage("process", List.of("ingest"), true, Duration.ofMinutes(2)),
                stage("embed-index", List.of("process"), false, null))));
        return props;
    }

    private static PipelineProperties.Stage stage(String name, List<String> deps, boolean idempotent, Duration timeout) {
        PipelineProperties.Stage stage = new PipelineProperties.Stage();
        stage.setName(name);
        stage.setDependsOn(deps);
        stage.setIdempotent(idempotent);
        stage.setTimeout(timeout);
        stage.setEndpoint(URI.create("http://localhost:8100/" + name));
        return stage;
    }
}
