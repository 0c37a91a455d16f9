package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.EventRecord;
import com.interfaceagent.orchestrator.model.EventStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record EventRecordResponse(
        String              eventId,
        String              eventType,
        String              source,
        UUID                executionId,
        Map<String, Object> payload,
        EventStatus         status,
        int                 retryCount,
        String              lastError,
        Instant             createdAt,
        Instant             processedAt
) {
    public static EventRecordResponse from(EventRecord r) {
        return new EventRecordResponse(
                r.getEventId(),
                r.getEventType(),
                r.getSource(),
                r.getExecutionId(),
                r.getPayload(),
                r.getStatus(),
                r.getRetryCount(),
                r.getLastError(),
                r.getCreatedAt(),
                r.getProcessedAt()
        );
    }
}
