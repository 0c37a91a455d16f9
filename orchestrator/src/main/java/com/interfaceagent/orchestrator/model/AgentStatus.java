package com.interfaceagent.orchestrator.model;

/**
 * Lifecycle of an Agent Definition.
 *
 * New definitions start INACTIVE. Only ACTIVE agents may be resolved
 * by a running pipeline step; every other status makes the step fail
 * with AGENT_UNAVAILABLE.
 */
public enum AgentStatus {
    ACTIVE,
    INACTIVE,
    ERROR,
    MAINTENANCE
}
