package com.researchpipeline.orchestrator.api.dto;

/**
 * Request body for POST /review/{taskId}.
 *
 * {@code editedReport} is required for EDIT, {@code rejectionReason} for
 * REJECT; both are ignored otherwise.
 */
public record ReviewRequest(Action action, String editedReport, String rejectionReason) {

    public enum Action { REQUEST_REVIEW, APPROVE, EDIT, REJECT }
}
