package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineStep;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Detached copy of a pipeline taken when an execution is accepted.
 * Steps are sorted by order; edits to the pipeline afterwards do not reach it.
 */
public record PipelineSnapshot(UUID pipelineId, String name, MergeStrategy mergeStrategy, List<StepSnapshot> steps) {

    public record StepSnapshot(UUID stepId, int order, UUID agentId, Map<String, Object> config) {}

    /**
     * @throws OrchestrationException STEP_ORDER_CONFLICT if two steps share an order value
     */
    public static PipelineSnapshot of(PipelineDefinition pipeline) {
        List<StepSnapshot> steps = new ArrayList<>();
        for (PipelineStep s : pipeline.getSteps()) {
            steps.add(new StepSnapshot(s.getId(), s.getStepOrder(), s.getAgentId(),
                    Map.copyOf(withoutNulls(s.getConfig()))));
        }
        steps.sort(Comparator.comparingInt(StepSnapshot::order));

        for (int i = 1; i < steps.size(); i++) {
            if (steps.get(i).order() == steps.get(i - 1).order()) {
                throw new OrchestrationException(OrchestrationException.Kind.STEP_ORDER_CONFLICT,
                        "Pipeline " + pipeline.getId() + " has more than one step with order " + steps.get(i).order());
            }
        }

        return new PipelineSnapshot(pipeline.getId(), pipeline.getName(),
                MergeStrategy.fromConfig(pipeline.getConfig()), List.copyOf(steps));
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> config) {
        Map<String, Object> copy = new LinkedHashMap<>();
        config.forEach((k, v) -> { if (v != null) copy.put(k, v); });
        return copy;
    }
}
