package com.interfaceagent.orchestrator.event;

/**
 * Durable record of published events and their processing state.
 *
 * Implementations never throw: the bus keeps working when the ledger cannot be
 * written, and the lost transition is logged.
 */
public interface EventLedger {

    /** The broker acknowledged {@code event}. */
    void recordPublished(DomainEvent event);

    /** {@code event} was received and is being handed to consumers. */
    void markProcessing(DomainEvent event);

    void markCompleted(DomainEvent event);

    void markFailed(DomainEvent event, String error);
}
