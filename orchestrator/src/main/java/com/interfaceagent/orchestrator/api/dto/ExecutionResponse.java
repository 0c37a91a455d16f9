package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.ExecutionStatus;
import com.interfaceagent.orchestrator.model.FailureCause;
import com.interfaceagent.orchestrator.model.PipelineExecution;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for POST /pipelines/{id}/execute and the execution listings.
 * output stays null until the execution is terminal.
 */
public record ExecutionResponse(
        UUID                id,
        UUID                pipelineId,
        ExecutionStatus     status,
        Map<String, Object> input,
        Map<String, Object> output,
        FailureCause        failureCause,
        String              errorMessage,
        String              requestedBy,
        boolean             eventsDegraded,
        Instant             startedAt,
        Instant             finishedAt
) {
    public static ExecutionResponse from(PipelineExecution e) {
        return new ExecutionResponse(
                e.getId(),
                e.getPipelineId(),
                e.getStatus(),
                e.getInput(),
                e.getOutput(),
                e.getFailureCause(),
                e.getErrorMessage(),
                e.getRequestedBy(),
                e.isEventsDegraded(),
                e.getStartedAt(),
                e.getFinishedAt()
        );
    }
}
