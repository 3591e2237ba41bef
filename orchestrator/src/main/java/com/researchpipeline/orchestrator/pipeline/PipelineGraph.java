package com.researchpipeline.orchestrator.pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, validated DAG of {@link StageDefinition}s.
 *
 * Stages keep their declaration order; every listing this class returns uses
 * it, so the same completed set always yields the same frontier in the same
 * order. A linear pipeline is the degenerate case where each stage depends on
 * the one declared before it.
 */
public final class PipelineGraph {

    private final Map<String, StageDefinition> stages;
    private final Set<String>                  sinks;

    private PipelineGraph(Map<String, StageDefinition> stages, Set<String> sinks) {
        this.stages = stages;
        this.sinks  = sinks;
    }

    /**
     * Validate and freeze a set of stage definitions.
     *
     * @throws DuplicateStageException     two stages share a name
     * @throws UnknownDependencyException  a dependency names no declared stage
     * @throws CycleDetectedException      the dependency edges contain a cycle
     *                                     (a stage depending on itself included)
     */
    public static PipelineGraph build(Collection<StageDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new PipelineConfigurationException("A pipeline needs at least one stage");
        }

        Map<String, StageDefinition> byName = new LinkedHashMap<>();
        for (StageDefinition def : definitions) {
            if (byName.putIfAbsent(def.name(), def) != null) {
                throw new DuplicateStageException(def.name());
            }
        }

        for (StageDefinition def : byName.values()) {
            for (String dep : def.dependsOn()) {
                if (!byName.containsKey(dep)) {
                    throw new UnknownDependencyException(def.name(), dep);
                }
            }
        }

        detectCycle(byName);

        Set<String> referenced = new HashSet<>();
        byName.values().forEach(def -> referenced.addAll(def.dependsOn()));
        Set<String> sinks = new LinkedHashSet<>();
        for (String name : byName.keySet()) {
            if (!referenced.contains(name)) sinks.add(name);
        }

        return new PipelineGraph(Collections.unmodifiableMap(byName), Collections.unmodifiableSet(sinks));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /**
     * The frontier: stages not in {@code completed} whose every dependency is.
     * Returned in declaration order.
     */
    public List<StageDefinition> readyStages(Set<String> completed) {
        List<StageDefinition> ready = new ArrayList<>();
        for (StageDefinition def : stages.values()) {
            if (!completed.contains(def.name()) && completed.containsAll(def.dependsOn())) {
                ready.add(def);
            }
        }
        return ready;
    }

    public StageDefinition stage(String name) {
        StageDefinition def = stages.get(name);
        if (def == null) {
            throw new IllegalArgumentException("No stage named '" + name + "' in this pipeline");
        }
        return def;
    }

    public boolean contains(String name) {
        return stages.containsKey(name);
    }

    /** Stage names in declaration order. */
    public List<String> stageNames() {
        return List.copyOf(stages.keySet());
    }

    public List<StageDefinition> stages() {
        return List.copyOf(stages.values());
    }

    public int size() {
        return stages.size();
    }

    /**
     * The stage whose output becomes the task report: the last declared stage
     * that no other stage depends on.
     */
    public StageDefinition reportStage() {
        String last = null;
        for (String sink : sinks) last = sink;
        return stages.get(last);
    }

    // ------------------------------------------------------------------
    // Validation
    // ------------------------------------------------------------------

    private enum Mark { VISITING, DONE }

    /** Depth-first search over dependency edges; reports the first cycle found. */
    private static void detectCycle(Map<String, StageDefinition> byName) {
        Map<String, Mark> marks = new HashMap<>();
        for (String start : byName.keySet()) {
            if (!marks.containsKey(start)) {
                visit(start, byName, marks, new ArrayList<>());
            }
        }
    }

    private static void visit(String name, Map<String, StageDefinition> byName,
                              Map<String, Mark> marks, List<String> path) {
        marks.put(name, Mark.VISITING);
        path.add(name);
        for (String dep : byName.get(name).dependsOn()) {
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(dep), path.size()));
                cycle.add(dep);
                throw new CycleDetectedException(cycle);
            }
            if (mark == null) {
                visit(dep, byName, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(name, Mark.DONE);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("PipelineGraph[");
        boolean first = true;
        for (StageDefinition def : stages.values()) {
            if (!first) sb.append(", ");
            sb.append(def.name());
            if (!def.dependsOn().isEmpty()) sb.append(" <- ").append(def.dependsOn());
            first = false;
        }
        return sb.append(']').toString();
    }
}
