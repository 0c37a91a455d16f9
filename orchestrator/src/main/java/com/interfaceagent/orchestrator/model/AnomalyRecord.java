package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A detected anomaly, kept for operator review.
 *
 * DB table: anomalies  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "anomalies")
public class AnomalyRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Event type the scored payload came from, e.g. "pipeline.step.succeeded".
    @Column(name = "detection_type", nullable = false)
    private String detectionType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AnomalySeverity severity;

    @Column(nullable = false)
    private double score;

    @Column(name = "source_event_id", nullable = false)
    private String sourceEventId;

    @Column(name = "execution_id")
    private UUID executionId;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> data;

    @Column(nullable = false)
    private boolean resolved = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected AnomalyRecord() {}   // required by JPA

    public AnomalyRecord(String detectionType, AnomalySeverity severity, double score,
                         String sourceEventId, UUID executionId, Map<String, Object> data) {
        this.detectionType = detectionType;
        this.severity      = severity;
        this.score         = score;
        this.sourceEventId = sourceEventId;
        this.executionId   = executionId;
        this.data          = data == null ? new LinkedHashMap<>() : new LinkedHashMap<>(data);
    }

    public UUID                getId()            { return id; }
    public String              getDetectionType() { return detectionType; }
    public AnomalySeverity     getSeverity()      { return severity; }
    public double              getScore()         { return score; }
    public String              getSourceEventId() { return sourceEventId; }
    public UUID                getExecutionId()   { return executionId; }
    public Map<String, Object> getData()          { return data; }
    public boolean             isResolved()       { return resolved; }
    public Instant             getCreatedAt()     { return createdAt; }
}
