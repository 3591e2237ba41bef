package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.model.TaskStatus;

import java.util.UUID;

/** A task's report together with the status it was read in. */
public record TaskReport(UUID taskId, TaskStatus status, String report) {}
