package com.interfaceagent.orchestrator.model;

/** Processing state of a logged event. */
public enum EventStatus {
    /** Acknowledged by the broker, not yet handed to consumers. */
    PENDING,
    PROCESSING,
    /** Every accepting consumer handled it. */
    COMPLETED,
    /** At least one consumer failed on the latest delivery; the broker redelivers it. */
    FAILED
}
