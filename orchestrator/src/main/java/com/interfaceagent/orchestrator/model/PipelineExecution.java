package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One run of a pipeline against an input payload.
 *
 * Mutated only by the ExecutionRunner driving it (or, for a dead owner, the
 * reaper); once the status is terminal every mutator throws. The row is
 * versioned so a stale copy can never overwrite a terminal state written by
 * another instance. Step results live in their own table
 * (step_results) and are written once per finished step.
 *
 * DB table: pipeline_executions  (created by Flyway V1, versioned by V2)
 */
@Entity
@Table(name = "pipeline_executions")
public class PipelineExecution {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Version
    private Long version;

    @Column(name = "pipeline_id", nullable = false, updatable = false)
    private UUID pipelineId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ExecutionStatus status = ExecutionStatus.PENDING;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "input_payload", columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> input;

    // Null until terminal.
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "output_payload", columnDefinition = "TEXT")
    private Map<String, Object> output;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_cause")
    private FailureCause failureCause;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Column(name = "requested_by", nullable = false, updatable = false)
    private String requestedBy;

    // Set when at least one event for this execution could not be published.
    @Column(name = "events_degraded", nullable = false)
    private boolean eventsDegraded = false;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    // Touched on every step transition; the reaper fails RUNNING rows whose heartbeat goes stale.
    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineExecution() {}   // required by JPA

    public PipelineExecution(UUID pipelineId, Map<String, Object> input, String requestedBy) {
        this.pipelineId  = pipelineId;
        this.input       = input == null ? new LinkedHashMap<>() : new LinkedHashMap<>(input);
        this.requestedBy = requestedBy;
    }

    // ------------------------------------------------------------------
    // State transitions
    // ------------------------------------------------------------------

    /** PENDING → RUNNING. Called once, before the row is first saved. */
    public void markRunning() {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException("Execution " + id + " is already " + status);
        }
        Instant now = Instant.now();
        this.status      = ExecutionStatus.RUNNING;
        this.startedAt   = now;
        this.heartbeatAt = now;
    }

    public void heartbeat() {
        requireRunning();
        this.heartbeatAt = Instant.now();
    }

    public void markEventsDegraded() {
        this.eventsDegraded = true;
    }

    /**
     * RUNNING → terminal. {@code cause} and {@code error} are only meaningful for FAILED.
     */
    public void finish(ExecutionStatus terminal, Map<String, Object> output,
                       FailureCause cause, String error) {
        requireRunning();
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        this.status       = terminal;
        this.output       = output == null ? new LinkedHashMap<>() : new LinkedHashMap<>(output);
        this.failureCause = cause;
        this.errorMessage = error;
        this.finishedAt   = Instant.now();
        this.heartbeatAt  = this.finishedAt;
    }

    private void requireRunning() {
        if (status != ExecutionStatus.RUNNING) {
            throw new IllegalStateException("Execution " + id + " is " + status + ", not RUNNING");
        }
    }

    // ------------------------------------------------------------------
    // Getters
    // ------------------------------------------------------------------

    public UUID                getId()             { return id; }
    public UUID                getPipelineId()     { return pipelineId; }
    public Long                getVersion()        { return version; }
    public ExecutionStatus     getStatus()         { return status; }
    public Map<String, Object> getInput()          { return input; }
    public Map<String, Object> getOutput()         { return output; }
    public FailureCause        getFailureCause()   { return failureCause; }
    public String              getErrorMessage()   { return errorMessage; }
    public String              getRequestedBy()    { return requestedBy; }
    public boolean             isEventsDegraded()  { return eventsDegraded; }
    public Instant             getStartedAt()      { return startedAt; }
    public Instant             getFinishedAt()     { return finishedAt; }
    public Instant             getHeartbeatAt()    { return heartbeatAt; }
}
