package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.PipelineStatus;

import java.util.Map;

/**
 * Request body for POST /pipelines and PUT /pipelines/{id}.
 *
 * status is ignored on create (pipelines start as DRAFT). config may carry
 * {@code merge_strategy}: "merge" (default) or "last".
 */
public record PipelineRequest(
        String              name,
        String              description,
        PipelineStatus      status,
        Map<String, Object> config
) {}
