package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.StepFailureKind;
import com.interfaceagent.orchestrator.model.StepRecovery;
import com.interfaceagent.orchestrator.model.StepResult;
import com.interfaceagent.orchestrator.model.StepStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record StepResultResponse(
        UUID                stepId,
        UUID                agentId,
        int                 order,
        StepStatus          status,
        boolean             critical,
        Map<String, Object> output,
        StepFailureKind     failureKind,
        String              error,
        StepRecovery        recovery,
        long                durationMs,
        Instant             finishedAt
) {
    public static StepResultResponse from(StepResult r) {
        return new StepResultResponse(
                r.getStepId(),
                r.getAgentId(),
                r.getStepOrder(),
                r.getStatus(),
                r.isCritical(),
                r.getOutput(),
                r.getFailureKind(),
                r.getError(),
                r.getRecovery(),
                r.getDurationMs(),
                r.getFinishedAt()
        );
    }
}
