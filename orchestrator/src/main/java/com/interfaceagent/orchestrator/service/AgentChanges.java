package com.interfaceagent.orchestrator.service;

import java.util.Map;

/** Partial update of an agent definition; null fields are left unchanged. */
public record AgentChanges(String name, String description, String version, Map<String, Object> config) {}
