package com.interfaceagent.orchestrator.event;

/**
 * Infrastructure failure behind the event bus. Degrades delivery guarantees;
 * never aborts a running pipeline execution.
 */
public class EventBusException extends RuntimeException {

    public enum Kind { BROKER_UNAVAILABLE, DEDUP_STORE_UNAVAILABLE }

    private final Kind kind;

    public EventBusException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
