package com.researchpipeline.orchestrator.api.dto;

import java.util.UUID;

/** Response body for GET /report/{taskId}. */
public record ReportResponse(UUID taskId, String status, String report) {}
