package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Append-only audit trail entry. No setters: rows are inserted and never
 * updated or deleted by this service (retention is handled outside it).
 *
 * DB table: audit_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "audit_records")
public class AuditRecord {

    // Column widths in audit_records; longer values are cut, never rejected.
    public static final int ACTOR_LENGTH       = 100;
    public static final int RESOURCE_ID_LENGTH = 100;
    public static final int ORIGIN_LENGTH      = 500;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // User id, or "system" for actions taken by the orchestrator itself.
    @Column(nullable = false, updatable = false, length = ACTOR_LENGTH)
    private String actor;

    @Column(nullable = false, updatable = false)
    private String action;

    @Column(name = "resource_type", nullable = false, updatable = false)
    private String resourceType;

    @Column(name = "resource_id", updatable = false, length = RESOURCE_ID_LENGTH)
    private String resourceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private AuditStatus status;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> details;

    // Remote address and/or user agent string of the caller, when known.
    @Column(updatable = false, length = ORIGIN_LENGTH)
    private String origin;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected AuditRecord() {}   // required by JPA

    public AuditRecord(String actor, String action, String resourceType, String resourceId,
                       AuditStatus status, Map<String, Object> details, String origin) {
        this.actor        = clip(actor, ACTOR_LENGTH);
        this.action       = action;
        this.resourceType = resourceType;
        this.resourceId   = clip(resourceId, RESOURCE_ID_LENGTH);
        this.status       = status;
        this.details      = details == null ? new LinkedHashMap<>() : new LinkedHashMap<>(details);
        this.origin       = clip(origin, ORIGIN_LENGTH);
    }

    public static String clip(String value, int maxLength) {
        return value == null || value.length() <= maxLength ? value : value.substring(0, maxLength);
    }

    public UUID                getId()           { return id; }
    public String              getActor()        { return actor; }
    public String              getAction()       { return action; }
    public String              getResourceType() { return resourceType; }
    public String              getResourceId()   { return resourceId; }
    public AuditStatus         getStatus()       { return status; }
    public Map<String, Object> getDetails()      { return details; }
    public String              getOrigin()       { return origin; }
    public Instant             getCreatedAt()    { return createdAt; }
}
