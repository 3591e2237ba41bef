package com.researchpipeline.orchestrator.api.dto;

import com.researchpipeline.orchestrator.service.TaskSummary;

import java.util.List;

/**
 * Response body for GET /tasks. {@code statusFilter} echoes the requested
 * statuses, null when the listing was unfiltered.
 */
public record TaskListResponse(
        List<TaskSummary> tasks,
        int               count,
        int               limit,
        int               offset,
        List<String>      statusFilter
) {}
