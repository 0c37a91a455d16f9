package com.interfaceagent.orchestrator.event;

/**
 * Durable publish/subscribe channel with at-least-once delivery and
 * per-consumer duplicate suppression.
 */
public interface EventBus {

    /**
     * Write the event to the broker and wait for the acknowledgement.
     *
     * @throws EventBusException BROKER_UNAVAILABLE if the write is not acknowledged in time
     */
    void publish(DomainEvent event);

    /** Register a consumer. Every subsequently delivered event it accepts is handed to it. */
    void subscribe(EventConsumer consumer);

    /** True while the published marker for {@code eventId} is held (bounded by the dedup TTL). */
    boolean wasPublished(String eventId);
}
