package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * The recorded outcome of one step of one execution. Written once, never updated.
 *
 * DB table: step_results  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "step_results")
public class StepResult {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "execution_id", nullable = false, updatable = false)
    private UUID executionId;

    @Column(name = "step_id", nullable = false, updatable = false)
    private UUID stepId;

    @Column(name = "agent_id", nullable = false, updatable = false)
    private UUID agentId;

    @Column(name = "step_order", nullable = false, updatable = false)
    private int stepOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private StepStatus status;

    @Column(nullable = false, updatable = false)
    private boolean critical;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "output_payload", columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> output;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_kind", updatable = false)
    private StepFailureKind failureKind;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String error;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private StepRecovery recovery = StepRecovery.NONE;

    @Column(name = "duration_ms", nullable = false, updatable = false)
    private long durationMs;

    @Column(name = "finished_at", nullable = false, updatable = false)
    private Instant finishedAt = Instant.now();

    protected StepResult() {}   // required by JPA

    private StepResult(UUID executionId, UUID stepId, UUID agentId, int stepOrder,
                       StepStatus status, boolean critical, Duration duration) {
        this.executionId = executionId;
        this.stepId      = stepId;
        this.agentId     = agentId;
        this.stepOrder   = stepOrder;
        this.status      = status;
        this.critical    = critical;
        this.durationMs  = duration.toMillis();
    }

    public static StepResult succeeded(UUID executionId, UUID stepId, UUID agentId, int stepOrder,
                                       boolean critical, Map<String, Object> output, Duration duration) {
        StepResult r = new StepResult(executionId, stepId, agentId, stepOrder,
                StepStatus.SUCCEEDED, critical, duration);
        r.output = output == null ? new LinkedHashMap<>() : new LinkedHashMap<>(output);
        return r;
    }

    public static StepResult failed(UUID executionId, UUID stepId, UUID agentId, int stepOrder,
                                    boolean critical, StepFailureKind kind, String error,
                                    StepRecovery recovery, Duration duration) {
        StepResult r = new StepResult(executionId, stepId, agentId, stepOrder,
                StepStatus.FAILED, critical, duration);
        r.failureKind = kind;
        r.error       = error;
        r.recovery    = recovery;
        return r;
    }

    public UUID                getId()          { return id; }
    public UUID                getExecutionId() { return executionId; }
    public UUID                getStepId()      { return stepId; }
    public UUID                getAgentId()     { return agentId; }
    public int                 getStepOrder()   { return stepOrder; }
    public StepStatus          getStatus()      { return status; }
    public boolean             isCritical()     { return critical; }
    public Map<String, Object> getOutput()      { return output; }
    public StepFailureKind     getFailureKind() { return failureKind; }
    public String              getError()       { return error; }
    public StepRecovery        getRecovery()    { return recovery; }
    public long                getDurationMs()  { return durationMs; }
    public Instant             getFinishedAt()  { return finishedAt; }

    public boolean isSucceeded() { return status == StepStatus.SUCCEEDED; }
}
