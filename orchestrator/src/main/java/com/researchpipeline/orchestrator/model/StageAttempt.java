package com.researchpipeline.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One attempt at running one stage for one task. Immutable once appended.
 *
 * {@code sequence} is the attempt's position in the task's history;
 * {@code attemptNumber} counts attempts of the same stage, starting at 1.
 *
 * DB table: stage_attempts  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "stage_attempts")
public class StageAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "task_id", nullable = false, updatable = false)
    private Task task;

    @Column(name = "stage_name", nullable = false, updatable = false)
    private String stageName;

    @Column(name = "attempt_number", nullable = false, updatable = false)
    private int attemptNumber;

    @Column(nullable = false, updatable = false)
    private int sequence;

    @Column(name = "started_at", nullable = false, updatable = false)
    private Instant startedAt;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AttemptOutcome outcome;

    @Column(name = "error_detail", columnDefinition = "TEXT", updatable = false)
    private String errorDetail;

    // Collaborator output on SUCCESS; handed to downstream stages.
    @Column(name = "output", columnDefinition = "TEXT", updatable = false)
    private String output;

    protected StageAttempt() {}   // required by JPA

    private StageAttempt(String stageName, int attemptNumber, Instant startedAt, Instant finishedAt,
                         AttemptOutcome outcome, String output, String errorDetail) {
        this.stageName     = stageName;
        this.attemptNumber = attemptNumber;
        this.startedAt     = startedAt;
        this.finishedAt    = finishedAt;
        this.outcome       = outcome;
        this.output        = output;
        this.errorDetail   = errorDetail;
    }

    public static StageAttempt success(String stageName, int attemptNumber,
                                       Instant startedAt, Instant finishedAt, String output) {
        return new StageAttempt(stageName, attemptNumber, startedAt, finishedAt,
                AttemptOutcome.SUCCESS, output, null);
    }

    public static StageAttempt failure(String stageName, int attemptNumber,
                                       Instant startedAt, Instant finishedAt, String errorDetail) {
        String detail = (errorDetail == null || errorDetail.isBlank()) ? "unknown error" : errorDetail;
        return new StageAttempt(stageName, attemptNumber, startedAt, finishedAt,
                AttemptOutcome.FAILURE, null, detail);
    }

    /** Called by the store when the attempt is appended; not part of the public contract. */
    public void attachTo(Task owner, int position) {
        if (this.task != null) {
            throw new IllegalStateException("Stage attempt already appended to task " + task.getId());
        }
        this.task     = owner;
        this.sequence = position;
    }

    public UUID           getId()            { return id; }
    public Task           getTask()          { return task; }
    public String         getStageName()     { return stageName; }
    public int            getAttemptNumber() { return attemptNumber; }
    public int            getSequence()      { return sequence; }
    public Instant        getStartedAt()     { return startedAt; }
    public Instant        getFinishedAt()    { return finishedAt; }
    public AttemptOutcome getOutcome()       { return outcome; }
    public String         getErrorDetail()   { return errorDetail; }
    public String         getOutput()        { return output; }

    public boolean isSuccess() { return outcome == AttemptOutcome.SUCCESS; }
}
