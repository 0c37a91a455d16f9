package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineStatus;
import com.interfaceagent.orchestrator.model.PipelineStep;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Response body for the /pipelines endpoints. Steps are listed in execution order.
 */
public record PipelineResponse(
        UUID                 id,
        String               name,
        String               description,
        PipelineStatus       status,
        Map<String, Object>  config,
        List<StepView>       steps,
        Instant              createdAt,
        Instant              updatedAt
) {
    public record StepView(UUID id, UUID agentId, int order, Map<String, Object> config) {

        public static StepView from(PipelineStep s) {
            return new StepView(s.getId(), s.getAgentId(), s.getStepOrder(), s.getConfig());
        }
    }

    public static PipelineResponse from(PipelineDefinition p) {
        return new PipelineResponse(
                p.getId(),
                p.getName(),
                p.getDescription(),
                p.getStatus(),
                p.getConfig(),
                p.getSteps().stream()
                        .sorted(Comparator.comparingInt(PipelineStep::getStepOrder))
                        .map(StepView::from)
                        .toList(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }

    /** Summary form for list endpoints; steps are not loaded. */
    public static PipelineResponse summary(PipelineDefinition p) {
        return new PipelineResponse(
                p.getId(),
                p.getName(),
                p.getDescription(),
                p.getStatus(),
                p.getConfig(),
                List.of(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
