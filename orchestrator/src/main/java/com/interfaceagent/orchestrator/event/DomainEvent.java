package com.interfaceagent.orchestrator.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable event carried by the {@link EventBus}.
 *
 * @param eventId     Unique id; redelivered copies share it, which is what dedup keys on.
 * @param type        One of {@link EventTypes}.
 * @param payload     Read-only view; consumers copy what they keep.
 * @param timestamp   When the event was created.
 * @param executionId Execution the event belongs to, or null.
 * @param source      Component that emitted it, e.g. "orchestrator".
 */
public record DomainEvent(
        String              eventId,
        String              type,
        Map<String, Object> payload,
        Instant             timestamp,
        UUID                executionId,
        String              source) {

    public DomainEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(type, "type");
        payload   = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static DomainEvent of(String eventId, String type, Map<String, Object> payload,
                                 UUID executionId, String source) {
        return new DomainEvent(eventId, type, payload, Instant.now(), executionId, source);
    }

    /**
     * Broker key. Events of one execution share a key, and therefore a partition,
     * which keeps them in publication order for every consumer.
     */
    public String partitionKey() {
        return executionId != null ? executionId.toString() : type;
    }
}
