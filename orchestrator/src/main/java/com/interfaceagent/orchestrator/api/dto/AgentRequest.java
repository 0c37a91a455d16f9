package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.AgentCategory;

import java.util.Map;

/**
 * Request body for POST /agents and PUT /agents/{id}.
 *
 * Required on create: name, agentType.
 * pluginModule / pluginSymbol mark the definition as plugin-backed; the module
 * is a jar path, a class directory, or "classpath:".
 * On update only name, description, version and config are read; absent fields
 * are left unchanged.
 */
public record AgentRequest(
        String              name,
        String              description,
        String              agentType,
        AgentCategory       category,
        String              version,
        Map<String, Object> config,
        String              pluginModule,
        String              pluginSymbol
) {}
