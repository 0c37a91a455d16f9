package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.orchestration.PipelineOrchestrator.ExecutionDetails;

import java.util.List;

/** Response body for GET /executions/{id}: the execution plus its step results in order. */
public record ExecutionDetailsResponse(ExecutionResponse execution, List<StepResultResponse> steps) {

    public static ExecutionDetailsResponse from(ExecutionDetails d) {
        return new ExecutionDetailsResponse(
                ExecutionResponse.from(d.execution()),
                d.steps().stream().map(StepResultResponse::from).toList());
    }
}
