package com.researchpipeline.orchestrator.service;

import com.researchpipeline.orchestrator.model.StageAttempt;
import com.researchpipeline.orchestrator.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One task with its run parameters and full stage history, as returned by
 * GET /tasks/{id}. The report itself is served by GET /report/{id}.
 */
public record TaskDetail(
        UUID                taskId,
        String              query,
        Map<String, Object> parameters,
        String              status,
        String              currentStage,
        String              errorMessage,
        boolean             cancelRequested,
        boolean             reportAvailable,
        Instant             createdAt,
        Instant             updatedAt,
        List<Attempt>       stageHistory
) {

    public record Attempt(
            int     sequence,
            String  stageName,
            int     attemptNumber,
            Instant startedAt,
            Instant finishedAt,
            String  outcome,
            String  errorDetail
    ) {
        static Attempt from(StageAttempt a) {
            return new Attempt(a.getSequence(), a.getStageName(), a.getAttemptNumber(),
                    a.getStartedAt(), a.getFinishedAt(), a.getOutcome().name(), a.getErrorDetail());
        }
    }

    public static TaskDetail from(Task task, List<StageAttempt> history) {
        return new TaskDetail(
                task.getId(),
                task.getQuery(),
                task.getParameters(),
                task.getStatus().name(),
                task.getCurrentStage(),
                task.getErrorMessage(),
                task.isCancelRequested(),
                task.getStatus().hasReport(),
                task.getCreatedAt(),
                task.getUpdatedAt(),
                history.stream().map(Attempt::from).toList()
        );
    }
}
