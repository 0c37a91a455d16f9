package com.interfaceagent.orchestrator.service;

import com.interfaceagent.orchestrator.model.AgentCategory;

import java.util.Map;

/**
 * Input for creating an agent definition. {@code category} and {@code version}
 * default to the registered type's; {@code pluginModule} and {@code pluginSymbol}
 * are set together for plugin-backed agents.
 */
public record AgentDraft(
        String              name,
        String              description,
        String              agentType,
        AgentCategory       category,
        String              version,
        Map<String, Object> config,
        String              pluginModule,
        String              pluginSymbol) {

    public boolean isPlugin() {
        return pluginModule != null && !pluginModule.isBlank();
    }
}
