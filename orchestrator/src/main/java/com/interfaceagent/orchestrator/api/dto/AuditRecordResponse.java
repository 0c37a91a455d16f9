package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.AuditRecord;
import com.interfaceagent.orchestrator.model.AuditStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AuditRecordResponse(
        UUID                id,
        String              actor,
        String              action,
        String              resourceType,
        String              resourceId,
        AuditStatus         status,
        Map<String, Object> details,
        String              origin,
        Instant             createdAt
) {
    public static AuditRecordResponse from(AuditRecord r) {
        return new AuditRecordResponse(
                r.getId(),
                r.getActor(),
                r.getAction(),
                r.getResourceType(),
                r.getResourceId(),
                r.getStatus(),
                r.getDetails(),
                r.getOrigin(),
                r.getCreatedAt()
        );
    }
}
