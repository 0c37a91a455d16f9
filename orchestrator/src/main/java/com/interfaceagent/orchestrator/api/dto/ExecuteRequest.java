package com.interfaceagent.orchestrator.api.dto;

import java.util.Map;

/** Request body for POST /pipelines/{id}/execute. A missing input runs against an empty map. */
public record ExecuteRequest(Map<String, Object> input) {

    public ExecuteRequest {
        if (input == null) input = Map.of();
    }
}
