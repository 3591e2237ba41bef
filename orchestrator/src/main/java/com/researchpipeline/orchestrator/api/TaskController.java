package com.researchpipeline.orchestrator.api;

import com.researchpipeline.orchestrator.api.dto.SubmitTaskRequest;
import com.researchpipeline.orchestrator.api.dto.TaskListResponse;
import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.service.TaskDetail;
import com.researchpipeline.orchestrator.service.TaskQueryService;
import com.researchpipeline.orchestrator.service.TaskSubmissionService;
import com.researchpipeline.orchestrator.service.TaskSummary;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * REST API for task lifecycle.
 *
 * GET  /tasks?status=a,b   list tasks, newest first
 * GET  /tasks/{id}         one task with its stage history
 * POST /tasks              submit a new pipeline run
 * POST /tasks/{id}/cancel  stop a run
 */
@RestController
@RequestMapping("/tasks")
public class TaskController {

    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT     = 500;

    private final TaskQueryService      queryService;
    private final TaskSubmissionService submissionService;

    public TaskController(TaskQueryService queryService, TaskSubmissionService submissionService) {
        this.queryService      = queryService;
        this.submissionService = submissionService;
    }

    /**
     * Example:
     *   curl 'http://localhost:8080/tasks?status=completed,pending_review&limit=20'
     */
    @GetMapping
    public TaskListResponse list(@RequestParam(name = "status", required = false) String status,
                                 @RequestParam(name = "limit", defaultValue = "50") int limit,
                                 @RequestParam(name = "offset", defaultValue = "0") int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                    "limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "offset must not be negative");
        }
        List<String> filter = parseFilter(status);
        List<TaskSummary> tasks = queryService.listTasks(filter, offset, limit);
        return new TaskListResponse(tasks, tasks.size(), limit, offset, filter);
    }

    /** Returns 404 if the task ID is not found. */
    @GetMapping("/{id}")
    public TaskDetail getTask(@PathVariable UUID id) {
        try {
            return queryService.getTask(id);
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        }
    }

    /**
     * Submit a new run.
     *
     * Example:
     *   curl -X POST http://localhost:8080/tasks \
     *     -H "Content-Type: application/json" \
     *     -d '{"query":"graph neural networks","parameters":{"max_papers":50}}'
     */
    @PostMapping
    public ResponseEntity<TaskSummary> submit(@RequestBody SubmitTaskRequest req) {
        if (req.query() == null || req.query().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query must not be blank");
        }
        Task task = submissionService.submit(req.query(), req.parameters());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskSummary.from(task));
    }

    /**
     * HTTP 202  cancellation recorded; in-flight stages finish first
     * HTTP 404  task ID not found
     * HTTP 409  task already finished
     */
    @PostMapping("/{id}/cancel")
    public ResponseEntity<TaskSummary> cancel(@PathVariable UUID id) {
        try {
            Task task = submissionService.cancel(id);
            return ResponseEntity.accepted().body(TaskSummary.from(task));
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (InvalidStatusTransitionException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }
    }

    private static List<String> parseFilter(String status) {
        if (status == null || status.isBlank()) return null;
        return Arrays.stream(status.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
