package com.researchpipeline.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.researchpipeline.orchestrator.executor.PipelineExecutor;
import com.researchpipeline.orchestrator.pipeline.PipelineGraph;
import com.researchpipeline.orchestrator.pipeline.StageDefinition;
import com.researchpipeline.orchestrator.retry.ExponentialBackoffRetryPolicy;
import com.researchpipeline.orchestrator.retry.FixedDelayRetryPolicy;
import com.researchpipeline.orchestrator.retry.RetryPolicy;
import com.researchpipeline.orchestrator.stage.HttpStageCollaborator;
import com.researchpipeline.orchestrator.stage.StageCollaborator;
import com.researchpipeline.orchestrator.stage.StageRegistry;
import com.researchpipeline.orchestrator.store.TaskStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the pipeline from {@link PipelineProperties}.
 *
 * A broken pipeline definition (cycle, unknown dependency, stage without a
 * collaborator) fails context startup.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    RetryPolicy defaultRetryPolicy(PipelineProperties properties) {
        return retryPolicy(properties.getRetry(), null, null);
    }

    @Bean
    PipelineGraph pipelineGraph(PipelineProperties properties) {
        List<StageDefinition> definitions = new ArrayList<>();
        for (PipelineProperties.Stage stage : properties.getStages()) {
            StageDefinition definition = StageDefinition
                    .of(stage.getName(), stage.getDependsOn().toArray(String[]::new))
                    .withIdempotent(stage.isIdempotent())
                    .withTimeout(stage.getTimeout());
            if (stage.getMaxAttempts() != null || stage.getRetryDelay() != null) {
                definition = definition.withRetryPolicy(
                        retryPolicy(properties.getRetry(), stage.getMaxAttempts(), stage.getRetryDelay()));
            }
            definitions.add(definition);
        }
        PipelineGraph graph = PipelineGraph.build(definitions);
        log.info("Pipeline configured: {}", graph);
        return graph;
    }

    /**
     * Collaborator beans from the context plus one HTTP collaborator for
     * every configured stage that names an endpoint.
     */
    @Bean
    StageRegistry stageRegistry(PipelineProperties properties,
                                PipelineGraph graph,
                                ObjectProvider<StageCollaborator> collaboratorBeans,
                                ObjectMapper objectMapper,
                                MeterRegistry meterRegistry) {
        List<StageCollaborator> collaborators = new ArrayList<>(collaboratorBeans.orderedStream().toList());
        HttpClient http = null;
        for (PipelineProperties.Stage stage : properties.getStages()) {
            if (stage.getEndpoint() == null) continue;
            if (http == null) http = HttpStageCollaborator.defaultClient();
            collaborators.add(new HttpStageCollaborator(stage.getName(), stage.getEndpoint(),
                    properties.getHttp().getRequestTimeout(), http, objectMapper));
        }
        StageRegistry registry = new StageRegistry(collaborators, meterRegistry);
        registry.verifyCovers(graph);
        return registry;
    }

    @Bean(destroyMethod = "shutdown")
    PipelineExecutor pipelineExecutor(TaskStore taskStore,
                                      StageRegistry stageRegistry,
                                      PipelineGraph graph,
                                      RetryPolicy defaultRetryPolicy,
                                      PipelineProperties properties,
                                      MeterRegistry meterRegistry) {
        PipelineProperties.Executor pools = properties.getExecutor();
        ExecutorService workers = Executors.newFixedThreadPool(
                pools.getStageWorkers(), namedThreads("stage-worker-"));
        ScheduledExecutorService timers = Executors.newScheduledThreadPool(
                pools.getTimerThreads(), namedThreads("stage-timer-"));
        return new PipelineExecutor(taskStore, stageRegistry, graph, defaultRetryPolicy,
                properties.getDefaultTimeout(), workers, timers, meterRegistry);
    }

    static RetryPolicy retryPolicy(PipelineProperties.Retry retry, Integer maxAttempts, Duration delay) {
        int attempts = maxAttempts != null ? maxAttempts : retry.getMaxAttempts();
        Duration first = delay != null ? delay : retry.getDelay();
        return switch (retry.getBackoff()) {
            case FIXED       -> new FixedDelayRetryPolicy(attempts, first);
            case EXPONENTIAL -> new ExponentialBackoffRetryPolicy(attempts, first,
                    retry.getMultiplier(), max(first, retry.getMaxDelay()));
        };
    }

    private static Duration max(Duration a, Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
