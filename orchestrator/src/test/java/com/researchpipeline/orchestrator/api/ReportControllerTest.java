package com.researchpipeline.orchestrator.api;

import com.researchpipeline.orchestrator.model.TaskStatus;
import com.researchpipeline.orchestrator.service.ReportNotReadyException;
import com.researchpipeline.orchestrator.service.TaskQueryService;
import com.researchpipeline.orchestrator.service.TaskReport;
import com.researchpipeline.orchestrator.store.TaskNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ReportController.class)
class ReportControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean TaskQueryService queryService;

    private final UUID taskId = UUID.randomUUID();

    @Test
    void getReport_completed_returnsJsonEnvelope() throws Exception {
        when(queryService.getReport(taskId)).thenReturn(report(TaskStatus.COMPLETED));

        mockMvc.perform(get("/report/{taskId}", taskId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.taskId").value(taskId.toString()))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.report").value("# Findings"));
        verify(queryService, never()).getTask(any());
    }

    @Test
    void getReport_markdownFormat_returnsRawText() throws Exception {
        when(queryService.getReport(taskId)).thenReturn(report(TaskStatus.APPROVED));

        mockMvc.perform(get("/report/{taskId}", taskId).param("format", "markdown"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("text/markdown"))
                .andExpect(content().string("# Findings"));
    }

    @Test
    void getReport_notReady_returns409() throws Exception {
        when(queryService.getReport(taskId)).thenThrow(new ReportNotReadyException(taskId, TaskStatus.RUNNING));

        mockMvc.perform(get("/report/{taskId}", taskId))
                .andExpect(status().isConflict());
    }

    @Test
    void getReport_unknown_returns404() throws Exception {
        when(queryService.getReport(taskId)).thenThrow(new TaskNotFoundException(taskId));

        mockMvc.perform(get("/report/{taskId}", taskId))
                .andExpect(status().isNotFound());
    }

    private TaskReport report(TaskStatus status) {
        return new TaskReport(taskId, status, "# Findings");
    }
}
