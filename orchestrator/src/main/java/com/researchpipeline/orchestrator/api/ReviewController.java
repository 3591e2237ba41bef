package com.researchpipeline.orchestrator.api;

import com.researchpipeline.orchestrator.api.dto.ReviewRequest;
import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.service.ReviewService;
import com.researchpipeline.orchestrator.service.TaskSummary;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * POST /review/{taskId}: reviewer actions on a finished report.
 *
 *   {"action":"REQUEST_REVIEW"}                     COMPLETED → PENDING_REVIEW
 *   {"action":"APPROVE"}                            COMPLETED | PENDING_REVIEW → APPROVED
 *   {"action":"EDIT","editedReport":"# Findings"}   PENDING_REVIEW → APPROVED with new text
 *   {"action":"REJECT","rejectionReason":"..."}     COMPLETED | PENDING_REVIEW → REJECTED
 *
 * REJECT answers with the task submitted to regenerate the report.
 */
@RestController
@RequestMapping("/review")
public class ReviewController {

    private final ReviewService reviewService;

    public ReviewController(ReviewService reviewService) {
        this.reviewService = reviewService;
    }

    @PostMapping("/{taskId}")
    public TaskSummary review(@PathVariable UUID taskId, @RequestBody ReviewRequest req) {
        if (req.action() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "action is required");
        }
        if (req.action() == ReviewRequest.Action.EDIT
                && (req.editedReport() == null || req.editedReport().isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "editedReport is required for EDIT");
        }
        if (req.action() == ReviewRequest.Action.REJECT
                && (req.rejectionReason() == null || req.rejectionReason().isBlank())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "rejectionReason is required for REJECT");
        }
        try {
            Task task = switch (req.action()) {
                case REQUEST_REVIEW -> reviewService.requestReview(taskId);
                case APPROVE        -> reviewService.approve(taskId);
                case EDIT           -> reviewService.edit(taskId, req.editedReport());
                case REJECT         -> reviewService.reject(taskId, req.rejectionReason());
            };
            return TaskSummary.from(task);
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (InvalidStatusTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }
}
