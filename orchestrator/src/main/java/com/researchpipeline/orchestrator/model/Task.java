package com.researchpipeline.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * One end-to-end pipeline run.
 *
 * A Task owns its append-only stage history. Status changes go through
 * {@link #transitionTo}, {@link #complete} and {@link #fail} so that the
 * report is present exactly while the status is COMPLETED, PENDING_REVIEW
 * or APPROVED.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Free-text label of the request, e.g. a research question.
    @Column(name = "query", columnDefinition = "TEXT")
    private String query;

    // Opaque run input, handed unchanged to every stage.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "parameters_json", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> parameters = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "report", columnDefinition = "TEXT")
    private String report;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Most recently started stage; informational only.
    @Column(name = "current_stage")
    private String currentStage;

    @Column(name = "cancel_requested", nullable = false)
    private boolean cancelRequested = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "task", cascade = CascadeType.ALL, fetch = FetchType.LAZY)
    @OrderBy("sequence ASC")
    private List<StageAttempt> stageHistory = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(String query, Map<String, Object> parameters) {
        this.query = query;
        if (parameters != null) {
            this.parameters = new LinkedHashMap<>(parameters);
        }
    }

    // ------------------------------------------------------------------
    // State changes
    // ------------------------------------------------------------------

    /**
     * Move to {@code next}. Entering a report-bearing status from one that
     * has no report is rejected (use {@link #complete}), and so is leaving a
     * report-bearing status for one without (use {@link #reject}).
     */
    public void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new InvalidStatusTransitionException(id, status, next);
        }
        if (status.hasReport() && !next.hasReport()) {
            throw new InvalidStatusTransitionException(id,
                    "leaving " + status + " for " + next + " drops the report; use reject");
        }
        if (next.hasReport() && !status.hasReport()) {
            throw new InvalidStatusTransitionException(id,
                    "status " + next + " requires a report; complete the task with one");
        }
        this.status = next;
    }

    /** RUNNING → COMPLETED with the report written in the same step. */
    public void complete(String reportText) {
        if (reportText == null || reportText.isBlank()) {
            throw new InvalidStatusTransitionException(id, "cannot complete with an empty report");
        }
        if (!status.canTransitionTo(TaskStatus.COMPLETED)) {
            throw new InvalidStatusTransitionException(id, status, TaskStatus.COMPLETED);
        }
        this.status = TaskStatus.COMPLETED;
        this.report = reportText;
    }

    /** Move to FAILED or CANCELLED and remember why. */
    public void fail(TaskStatus terminal, String message) {
        if (terminal != TaskStatus.FAILED && terminal != TaskStatus.CANCELLED) {
            throw new IllegalArgumentException("Not a failure status: " + terminal);
        }
        if (!status.canTransitionTo(terminal)) {
            throw new InvalidStatusTransitionException(id, status, terminal);
        }
        this.status = terminal;
        this.errorMessage = message;
    }

    /** COMPLETED or PENDING_REVIEW → REJECTED; the report is discarded. */
    public void reject(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A rejection needs a reason");
        }
        if (!status.canTransitionTo(TaskStatus.REJECTED)) {
            throw new InvalidStatusTransitionException(id, status, TaskStatus.REJECTED);
        }
        this.status = TaskStatus.REJECTED;
        this.report = null;
        this.errorMessage = "Rejected by reviewer: " + reason;
    }

    /** Replace the report of a task that already has one (reviewer edit). */
    public void replaceReport(String reportText) {
        if (!status.hasReport()) {
            throw new InvalidStatusTransitionException(id,
                    "report can only be set once the task is " + TaskStatus.COMPLETED + " or later");
        }
        if (reportText == null || reportText.isBlank()) {
            throw new InvalidStatusTransitionException(id, "report must not be empty");
        }
        this.report = reportText;
    }

    /** Bump updatedAt for changes that do not touch a column of this row. */
    public void touch() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID                getId()              { return id; }
    public String              getQuery()           { return query; }
    public Map<String, Object> getParameters()      { return parameters; }
    public TaskStatus          getStatus()          { return status; }
    public String              getReport()          { return report; }
    public String              getErrorMessage()    { return errorMessage; }
    public String              getCurrentStage()    { return currentStage; }
    public boolean             isCancelRequested()  { return cancelRequested; }
    public Instant             getCreatedAt()       { return createdAt; }
    public Instant             getUpdatedAt()       { return updatedAt; }
    public List<StageAttempt>  getStageHistory()    { return stageHistory; }

    public void setCurrentStage(String currentStage)     { this.currentStage = currentStage; }
    public void setCancelRequested(boolean requested)    { this.cancelRequested = requested; }
}
