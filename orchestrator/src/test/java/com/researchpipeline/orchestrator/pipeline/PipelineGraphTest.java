package com.researchpipeline.orchestrator.pipeline;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineGraphTest {

    private static final PipelineGraph LINEAR = PipelineGraph.build(List.of(
            StageDefinition.of("ingest"),
            StageDefinition.of("process", "ingest"),
            StageDefinition.of("embed-index", "process").withIdempotent(false)));

    // ------------------------------------------------------------------
    // readyStages()
    // ------------------------------------------------------------------

    @Test
    void readyStages_nothingCompleted_returnsRoots() {
        assertThat(names(LINEAR.readyStages(Set.of()))).containsExactly("ingest");
    }

    @Test
    void readyStages_followsDependencies() {
        assertThat(names(LINEAR.readyStages(Set.of("ingest")))).containsExactly("process");
        assertThat(names(LINEAR.readyStages(Set.of("ingest", "process")))).containsExactly("embed-index");
    }

    @Test
    void readyStages_allCompleted_isEmpty() {
        assertThat(LINEAR.readyStages(Set.of("ingest", "process", "embed-index"))).isEmpty();
    }

    @Test
    void readyStages_diamond_releasesBothBranchesThenTheJoin() {
        PipelineGraph diamond = PipelineGraph.build(List.of(
                StageDefinition.of("a"),
                StageDefinition.of("b", "a"),
                StageDefinition.of("c", "a"),
                StageDefinition.of("d", "b", "c")));

        assertThat(names(diamond.readyStages(Set.of("a")))).containsExactly("b", "c");
        assertThat(names(diamond.readyStages(Set.of("a", "b")))).containsExactly("c");
        assertThat(names(diamond.readyStages(Set.of("a", "b", "c")))).containsExactly("d");
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    @Test
    void build_cycle_isRejectedWithThePath() {
        assertThatThrownBy(() -> PipelineGraph.build(List.of(
                StageDefinition.of("a", "c"),
                StageDefinition.of("b", "a"),
                StageDefinition.of("c", "b"))))
                .isInstanceOfSatisfying(CycleDetectedException.class, e ->
                        assertThat(e.getCycle()).contains("a", "b", "c"));
    }

    @Test
    void build_selfDependency_isACycle() {
        assertThatThrownBy(() -> PipelineGraph.build(List.of(StageDefinition.of("a", "a"))))
                .isInstanceOf(CycleDetectedException.class);
    }

    @Test
    void build_unknownDependency_isRejected() {
        assertThatThrownBy(() -> PipelineGraph.build(List.of(StageDefinition.of("process", "ingest"))))
                .isInstanceOf(UnknownDependencyException.class)
                .hasMessageContaining("ingest");
    }

    @Test
    void build_duplicateName_isRejected() {
        assertThatThrownBy(() -> PipelineGraph.build(List.of(StageDefinition.of("a"), StageDefinition.of("a"))))
                .isInstanceOf(DuplicateStageException.class);
    }

    @Test
    void build_empty_isRejected() {
        assertThatThrownBy(() -> PipelineGraph.build(List.of()))
                .isInstanceOf(PipelineConfigurationException.class);
    }

    @Test
    void stageDefinition_nonPositiveTimeout_isRejected() {
        assertThatThrownBy(() -> StageDefinition.of("a").withTimeout(Duration.ZERO))
                .isInstanceOf(PipelineConfigurationException.class);
    }

    // ------------------------------------------------------------------
    // Report stage
    // ------------------------------------------------------------------

    @Test
    void reportStage_isTheLastDeclaredSink() {
        assertThat(LINEAR.reportStage().name()).isEqualTo("embed-index");

        PipelineGraph twoSinks = PipelineGraph.build(List.of(
                StageDefinition.of("ingest"),
                StageDefinition.of("summary", "ingest"),
                StageDefinition.of("index", "ingest")));
        assertThat(twoSinks.reportStage().name()).isEqualTo("index");
    }

    private static List<String> names(List<StageDefinition> stages) {
        return stages.stream().map(StageDefinition::name).toList();
    }
}
