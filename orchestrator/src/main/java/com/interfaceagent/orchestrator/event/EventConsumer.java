package com.interfaceagent.orchestrator.event;

/**
 * Receiver of bus events.
 *
 * {@link #name()} scopes duplicate suppression, so it must be stable across
 * restarts and unique among consumers. A handler that throws gets the event
 * again on redelivery.
 */
public interface EventConsumer {

    String name();

    default boolean accepts(String eventType) {
        return true;
    }

    void handle(DomainEvent event);
}
