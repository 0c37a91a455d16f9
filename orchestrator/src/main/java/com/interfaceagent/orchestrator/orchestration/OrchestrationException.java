package com.interfaceagent.orchestrator.orchestration;

/**
 * Configuration or lookup error surfaced to the caller of an orchestration
 * or CRUD operation. Never retried.
 */
public class OrchestrationException extends RuntimeException {

    public enum Kind {
        PIPELINE_NOT_FOUND,
        PIPELINE_NOT_ACTIVE,
        STEP_ORDER_CONFLICT,
        STEP_NOT_FOUND,
        AGENT_NOT_FOUND,
        AGENT_UNAVAILABLE,
        AGENT_IN_USE,
        UNKNOWN_AGENT_TYPE,
        DUPLICATE_NAME,
        EXECUTION_NOT_FOUND
    }

    private final Kind kind;

    public OrchestrationException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public OrchestrationException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
