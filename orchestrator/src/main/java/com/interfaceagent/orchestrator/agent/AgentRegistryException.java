package com.interfaceagent.orchestrator.agent;

/**
 * Configuration error raised by {@link AgentRegistry}. Never retried.
 */
public class AgentRegistryException extends RuntimeException {

    public enum Kind { DUPLICATE_TYPE, UNKNOWN_TYPE, INSTANTIATION_FAILED }

    private final Kind   kind;
    private final String typeName;

    public AgentRegistryException(Kind kind, String typeName, String message) {
        super("[" + kind + "] " + message);
        this.kind     = kind;
        this.typeName = typeName;
    }

    public AgentRegistryException(Kind kind, String typeName, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind     = kind;
        this.typeName = typeName;
    }

    public Kind   getKind()     { return kind; }
    public String getTypeName() { return typeName; }
}
