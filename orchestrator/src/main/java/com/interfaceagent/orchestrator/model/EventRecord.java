package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Persisted trace of one bus event and how far its processing got.
 *
 * DB table: event_log  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "event_log")
public class EventRecord {

    public static final int EVENT_ID_LENGTH = 300;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "event_id", nullable = false, unique = true, length = EVENT_ID_LENGTH)
    private String eventId;

    @Column(name = "event_type", nullable = false, length = 100)
    private String eventType;

    @Column(length = 100)
    private String source;

    @Column(name = "execution_id")
    private UUID executionId;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EventStatus status = EventStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "processed_at")
    private Instant processedAt;

    protected EventRecord() {}   // required by JPA

    public EventRecord(String eventId, String eventType, String source, UUID executionId,
                       Map<String, Object> payload) {
        this.eventId     = eventId;
        this.eventType   = eventType;
        this.source      = source;
        this.executionId = executionId;
        this.payload     = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markProcessing() {
        this.status = EventStatus.PROCESSING;
    }

    public void markCompleted() {
        this.status      = EventStatus.COMPLETED;
        this.lastError   = null;
        this.processedAt = Instant.now();
    }

    /** Each failed delivery counts as one retry the broker still owes. */
    public void markFailed(String error) {
        this.status    = EventStatus.FAILED;
        this.lastError = error;
        this.retryCount++;
    }

    public UUID                getId()          { return id; }
    public String              getEventId()     { return eventId; }
    public String              getEventType()   { return eventType; }
    public String              getSource()      { return source; }
    public UUID                getExecutionId() { return executionId; }
    public Map<String, Object> getPayload()     { return payload; }
    public EventStatus         getStatus()      { return status; }
    public int                 getRetryCount()  { return retryCount; }
    public String              getLastError()   { return lastError; }
    public Instant             getCreatedAt()   { return createdAt; }
    public Instant             getProcessedAt() { return processedAt; }
}
