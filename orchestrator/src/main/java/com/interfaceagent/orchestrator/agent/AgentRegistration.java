package com.interfaceagent.orchestrator.agent;

import com.interfaceagent.orchestrator.model.AgentCategory;

/**
 * Binds a type name to the factory that builds it.
 *
 * @param typeName  Registry key referenced by Agent Definitions (e.g. "validator").
 * @param category  Informational category.
 * @param version   Version of the implementation.
 * @param reentrant true if one instance may safely serve concurrent executions;
 *                  the registry then caches one instance per configuration.
 * @param factory   Builds a fresh instance per call.
 */
public record AgentRegistration(
        String        typeName,
        AgentCategory category,
        String        version,
        boolean       reentrant,
        AgentFactory  factory) {

    public static AgentRegistration of(String typeName, AgentCategory category, AgentFactory factory) {
        return new AgentRegistration(typeName, category, "1.0.0", false, factory);
    }
}
