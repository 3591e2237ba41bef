package com.researchpipeline.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed view of the {@code pipeline.*} settings in application.yml.
 *
 * <pre>
 * pipeline:
 *   default-timeout: 30m
 *   retry:
 *     max-attempts: 2
 *     delay: 5m
 *   stages:
 *     - name: ingest
 *       endpoint: http://localhost:8101/ingest
 *     - name: process
 *       depends-on: [ingest]
 * </pre>
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Stage timeout applied when a stage does not set its own. */
    private Duration defaultTimeout = Duration.ofMinutes(30);

    private Retry     retry     = new Retry();
    private Executor  executor  = new Executor();
    private Recovery  recovery  = new Recovery();
    private Schedule  schedule  = new Schedule();
    private Http      http      = new Http();
    private List<Stage> stages  = new ArrayList<>();

    public Duration getDefaultTimeout()              { return defaultTimeout; }
    public void setDefaultTimeout(Duration value)    { this.defaultTimeout = value; }
    public Retry getRetry()                          { return retry; }
    public void setRetry(Retry retry)                { this.retry = retry; }
    public Executor getExecutor()                    { return executor; }
    public void setExecutor(Executor executor)       { this.executor = executor; }
    public Recovery getRecovery()                    { return recovery; }
    public void setRecovery(Recovery recovery)       { this.recovery = recovery; }
    public Schedule getSchedule()                    { return schedule; }
    public void setSchedule(Schedule schedule)       { this.schedule = schedule; }
    public Http getHttp()                            { return http; }
    public void setHttp(Http http)                   { this.http = http; }
    public List<Stage> getStages()                   { return stages; }
    public void setStages(List<Stage> stages)        { this.stages = stages; }

    public enum Backoff { FIXED, EXPONENTIAL }

    public static class Retry {
        /** Total attempts per stage, the first one included. */
        private int      maxAttempts = 2;
        private Duration delay       = Duration.ofMinutes(5);
        private Backoff  backoff     = Backoff.FIXED;
        private double   multiplier  = 2.0;
        private Duration maxDelay    = Duration.ofMinutes(30);

        public int getMaxAttempts()               { return maxAttempts; }
        public void setMaxAttempts(int value)     { this.maxAttempts = value; }
        public Duration getDelay()                { return delay; }
        public void setDelay(Duration value)      { this.delay = value; }
        public Backoff getBackoff()               { return backoff; }
        public void setBackoff(Backoff value)     { this.backoff = value; }
        public double getMultiplier()             { return multiplier; }
        public void setMultiplier(double value)   { this.multiplier = value; }
        public Duration getMaxDelay()             { return maxDelay; }
        public void setMaxDelay(Duration value)   { this.maxDelay = value; }
    }

    public static class Executor {
        private int stageWorkers = 8;
        private int timerThreads = 2;

        public int getStageWorkers()              { return stageWorkers; }
        public void setStageWorkers(int value)    { this.stageWorkers = value; }
        public int getTimerThreads()              { return timerThreads; }
        public void setTimerThreads(int value)    { this.timerThreads = value; }
    }

    public static class Recovery {
        private boolean enabled = true;

        public boolean isEnabled()                { return enabled; }
        public void setEnabled(boolean value)     { this.enabled = value; }
    }

    public static class Schedule {
        /** Spring cron expression; "-" disables the trigger. */
        private String cron = "-";
        private String query = "scheduled ingest";
        private Map<String, Object> parameters = new LinkedHashMap<>();

        public String getCron()                              { return cron; }
        public void setCron(String value)                    { this.cron = value; }
        public String getQuery()                             { return query; }
        public void setQuery(String value)                   { this.query = value; }
        public Map<String, Object> getParameters()           { return parameters; }
        public void setParameters(Map<String, Object> value) { this.parameters = value; }
    }

    public static class Http {
        /** Per-request timeout for HTTP stage collaborators. */
        private Duration requestTimeout = Duration.ofMinutes(10);

        public Duration getRequestTimeout()           { return requestTimeout; }
        public void setRequestTimeout(Duration value) { this.requestTimeout = value; }
    }

    public static class Stage {
        private String       name;
        private List<String> dependsOn  = new ArrayList<>();
        private boolean      idempotent = true;
        private Duration     timeout;
        /** When set, the stage is served by an HTTP collaborator at this address. */
        private URI          endpoint;
        /** Per-stage override of {@code pipeline.retry.max-attempts}. */
        private Integer      maxAttempts;
        /** Per-stage override of {@code pipeline.retry.delay}. */
        private Duration     retryDelay;

        public String getName()                      { return name; }
        public void setName(String value)            { this.name = value; }
        public List<String> getDependsOn()           { return dependsOn; }
        public void setDependsOn(List<String> value) { this.dependsOn = value; }
        public boolean isIdempotent()                { return idempotent; }
        public void setIdempotent(boolean value)     { this.idempotent = value; }
        public Duration getTimeout()                 { return timeout; }
        public void setTimeout(Duration value)       { this.timeout = value; }
        public URI getEndpoint()                     { return endpoint; }
        public void setEndpoint(URI value)           { this.endpoint = value; }
        public Integer getMaxAttempts()              { return maxAttempts; }
        public void setMaxAttempts(Integer value)    { this.maxAttempts = value; }
        public Duration getRetryDelay()              { return retryDelay; }
        public void setRetryDelay(Duration value)    { this.retryDelay = value; }
    }
}
