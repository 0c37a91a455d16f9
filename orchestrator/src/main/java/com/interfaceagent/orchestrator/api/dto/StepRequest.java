package com.interfaceagent.orchestrator.api.dto;

import java.util.Map;
import java.util.UUID;

/**
 * Request body for POST /pipelines/{id}/steps.
 *
 * config keys {@code critical} (default true) and {@code timeout_ms} are read
 * by the orchestrator; every other key overlays the agent's configuration.
 */
public record StepRequest(UUID agentId, int order, Map<String, Object> config) {}
