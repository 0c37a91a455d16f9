package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One step of a pipeline: binds an agent to a position in the execution order.
 *
 * {@code stepOrder} is unique within a pipeline (DB constraint
 * uq_pipeline_steps_order). The per-step config overlays the agent's config;
 * the reserved keys {@code critical} and {@code timeout_ms} are read by the
 * orchestrator and never passed to the agent.
 *
 * DB table: pipeline_steps  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_steps")
public class PipelineStep {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "pipeline_id", nullable = false)
    private PipelineDefinition pipeline;

    // Plain reference: an agent definition may not be deleted while a step points at it.
    @Column(name = "agent_id", nullable = false)
    private UUID agentId;

    @Column(name = "step_order", nullable = false)
    private int stepOrder;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> config = new LinkedHashMap<>();

    protected PipelineStep() {}   // required by JPA

    PipelineStep(PipelineDefinition pipeline, UUID agentId, int stepOrder, Map<String, Object> config) {
        this.pipeline  = pipeline;
        this.agentId   = agentId;
        this.stepOrder = stepOrder;
        this.config    = config == null ? new LinkedHashMap<>() : new LinkedHashMap<>(config);
    }

    public UUID               getId()        { return id; }
    public PipelineDefinition getPipeline()  { return pipeline; }
    public UUID               getAgentId()   { return agentId; }
    public int                getStepOrder() { return stepOrder; }

    public Map<String, Object> getConfig() {
        return config == null ? Map.of() : config;
    }
}
