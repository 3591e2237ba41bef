package com.researchpipeline.orchestrator.api;

import com.researchpipeline.orchestrator.model.InvalidStatusTransitionException;
import com.researchpipeline.orchestrator.model.Task;
import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.service.TaskDetail;
import com.researchpipeline.orchestrator.service.TaskQueryService;
import com.researchpipeline.orchestrator.service.TaskSubmissionService;
import com.researchpipeline.orchestrator.service.TaskSummary;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for TaskController: web layer only, services mocked.
 */
@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean TaskQueryService      queryService;
    @MockitoBean TaskSubmissionService submissionService;

    // ------------------------------------------------------------------
    // GET /tasks
    // ------------------------------------------------------------------

    @Test
    void list_splitsStatusFilterAndEchoesPaging() throws Exception {
        TaskSummary summary = summary(TaskStatus.COMPLETED);
        when(queryService.listTasks(List.of("completed", "approved"), 0, 20)).thenReturn(List.of(summary));

        mockMvc.perform(get("/tasks").param("status", "completed, approved").param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.limit").value(20))
                .andExpect(jsonPath("$.offset").value(0))
                .andExpect(jsonPath("$.statusFilter[1]").value("approved"))
                .andExpect(jsonPath("$.tasks[0].status").value("COMPLETED"))
                .andExpect(jsonPath("$.tasks[0].reportAvailable").value(true));
    }

    @Test
    void list_withoutFilter_passesNull() throws Exception {
        when(queryService.listTasks(null, 0, TaskController.DEFAULT_LIMIT)).thenReturn(List.of());

        mockMvc.perform(get("/tasks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0))
                .andExpect(jsonPath("$.statusFilter").doesNotExist());
    }

    @Test
    void list_limitOutOfRange_returns400() throws Exception {
        mockMvc.perform(get("/tasks").param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    // ------------------------------------------------------------------
    // GET /tasks/{id}
    // ------------------------------------------------------------------

    @Test
    void getTask_existing_returnsHistory() throws Exception {
        UUID id = UUID.randomUUID();
        Instant t = Instant.parse("2024-05-01T10:00:00Z");
        TaskDetail detail = new TaskDetail(id, "q", Map.of("max", 5), "RUNNING", "process", null,
                false, false, t, t,
                List.of(new TaskDetail.Attempt(1, "ingest", 1, t, t, "SUCCESS", null),
                        new TaskDetail.Attempt(2, "process", 1, t, t, "FAILURE", "HTTP 503")));
        when(queryService.getTask(id)).thenReturn(detail);

        mockMvc.perform(get("/tasks/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RUNNING"))
                .andExpect(jsonPath("$.stageHistory.length()").value(2))
                .andExpect(jsonPath("$.stageHistory[1].errorDetail").value("HTTP 503"));
    }

    @Test
    void getTask_unknown_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(queryService.getTask(id)).thenThrow(new TaskNotFoundException(id));

        mockMvc.perform(get("/tasks/{id}", id))
                .andExpect(status().isNotFound());
    }

    // ------------------------------------------------------------------
    // POST /tasks
    // ------------------------------------------------------------------

    @Test
    void submit_validRequest_returns201() throws Exception {
        Task task = fakeTask();
        when(submissionService.submit(eq("graph neural networks"), any())).thenReturn(task);

        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"query":"graph neural networks","parameters":{"max_papers":5}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.taskId").value(task.getId().toString()))
                .andExpect(jsonPath("$.status").value("PENDING"));
    }

    @Test
    void submit_blankQuery_returns400() throws Exception {
        mockMvc.perform(post("/tasks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\" \"}"))
                .andExpect(status().isBadRequest());
        verify(submissionService, never()).submit(any(), any());
    }

    // ------------------------------------------------------------------
    // POST /tasks/{id}/cancel
    // ------------------------------------------------------------------

    @Test
    void cancel_running_returns202() throws Exception {
        Task task = fakeTask();
        when(submissionService.cancel(task.getId())).thenReturn(task);

        mockMvc.perform(post("/tasks/{id}/cancel", task.getId()))
                .andExpect(status().isAccepted());
    }

    @Test
    void cancel_finished_returns409() throws Exception {
        UUID id = UUID.randomUUID();
        when(submissionService.cancel(id)).thenThrow(new InvalidStatusTransitionException(id, "already COMPLETED"));

        mockMvc.perform(post("/tasks/{id}/cancel", id))
                .andExpect(status().isConflict());
    }

    @Test
    void cancel_unknown_returns404() throws Exception {
        UUID id = UUID.randomUUID();
        when(submissionService.cancel(id)).thenThrow(new TaskNotFoundException(id));

        mockMvc.perform(post("/tasks/{id}/cancel", id))
                .andExpect(status().isNotFound());
    }

    private static TaskSummary summary(TaskStatus status) {
        Instant t = Instant.parse("2024-05-01T10:00:00Z");
        return new TaskSummary(UUID.randomUUID(), "q", status.name(), null, null, status.hasReport(), t, t);
    }

    private static Task fakeTask() {
        Task task = new Task("graph neural networks", Map.of("max_papers", 5));
        ReflectionTestUtils.setField(task, "id", UUID.randomUUID());
        return task;
    }
}
