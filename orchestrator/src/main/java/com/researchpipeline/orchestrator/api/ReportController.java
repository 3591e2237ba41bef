package com.researchpipeline.orchestrator.api;

import com.researchpipeline.orchestrator.api.dto.ReportResponse;
import com.researchpipeline.orchestrator.service.ReportNotReadyException;
import com.researchpipeline.orchestrator.service.TaskQueryService;
import com.researchpipeline.orchestrator.service.TaskReport;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * GET /report/{taskId}                  JSON envelope with the report text
 * GET /report/{taskId}?format=markdown  the report itself as text/markdown
 *
 * HTTP 404  task ID not found
 * HTTP 409  the task has no report yet (still running, failed or cancelled)
 */
@RestController
@RequestMapping("/report")
public class ReportController {

    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final TaskQueryService queryService;

    public ReportController(TaskQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<?> getReport(@PathVariable UUID taskId,
                                       @RequestParam(name = "format", defaultValue = "json") String format) {
        TaskReport report;
        try {
            report = queryService.getReport(taskId);
        } catch (TaskNotFoundException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage());
        } catch (ReportNotReadyException e) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage());
        }

        if ("markdown".equalsIgnoreCase(format)) {
            return ResponseEntity.ok().contentType(TEXT_MARKDOWN).body(report.report());
        }
        if (!"json".equalsIgnoreCase(format)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unsupported format: " + format);
        }
        return ResponseEntity.ok(new ReportResponse(taskId, report.status().name(), report.report()));
    }
}
