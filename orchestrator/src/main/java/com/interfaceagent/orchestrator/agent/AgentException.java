package com.interfaceagent.orchestrator.agent;

/**
 * Failure raised by, or on behalf of, an agent during a step.
 *
 * Agents throw PROCESSING_FAILED themselves; the orchestrator creates
 * VALIDATION_FAILED, TIMEOUT and CANCELLED instances when it has to abandon a call, and wraps
 * any other exception from {@code execute} as PROCESSING_FAILED before
 * handing it to {@link Agent#onError}.
 */
public class AgentException extends RuntimeException {

    public enum Kind { VALIDATION_FAILED, PROCESSING_FAILED, TIMEOUT, CANCELLED }

    private final Kind kind;

    public AgentException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public AgentException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public static AgentException processingFailed(String message) {
        return new AgentException(Kind.PROCESSING_FAILED, message);
    }

    public Kind getKind() { return kind; }
}
