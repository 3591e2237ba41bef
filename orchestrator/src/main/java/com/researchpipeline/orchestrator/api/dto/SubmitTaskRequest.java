package com.researchpipeline.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /tasks.
 *
 * Required: query
 * Optional: parameters, handed unchanged to every stage (e.g. "max_papers").
 */
public record SubmitTaskRequest(String query, Map<String, Object> parameters) {

    public SubmitTaskRequest {
        if (parameters == null) parameters = Map.of();
    }
}
