package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.config.PipelineProperties;
import com.researchpipeline.orchestrator.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Submits a run on a cron schedule, e.g. a daily ingest of new papers.
 *
 * Disabled unless {@code pipeline.schedule.cron} is set; "-" (the default)
 * turns the trigger off.
 */
@Component
@EnableScheduling
public class PipelineSchedule {

    private static final Logger log = LoggerFactory.getLogger(PipelineSchedule.class);

    private final TaskSubmissionService submissionService;
    private final PipelineProperties.Schedule schedule;

    public PipelineSchedule(TaskSubmissionService submissionService, PipelineProperties properties) {
        this.submissionService = submissionService;
        this.schedule          = properties.getSchedule();
    }

    @Scheduled(cron = "${pipeline.schedule.cron:-}")
    public void trigger() {
        Task task = submissionService.submit(schedule.getQuery(), schedule.getParameters());
        log.info("Scheduled run submitted as task {}", task.getId());
    }
}
