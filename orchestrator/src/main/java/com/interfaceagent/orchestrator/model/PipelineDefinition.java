package com.interfaceagent.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * An ordered composition of agent-bound steps.
 *
 * The steps collection is lazy; the orchestrator loads it through
 * {@code PipelineRepository.findWithStepsById} and snapshots it when an
 * execution is accepted, so later edits never reach a running execution.
 *
 * DB table: pipelines  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipelines")
public class PipelineDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, unique = true)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineStatus status = PipelineStatus.DRAFT;

    // Pipeline-wide settings, e.g. {"merge_strategy": "last"}.
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> config = new LinkedHashMap<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @OneToMany(mappedBy = "pipeline", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("stepOrder ASC")
    private List<PipelineStep> steps = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineDefinition() {}   // required by JPA

    public PipelineDefinition(String name, String description) {
        this.name        = name;
        this.description = description;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID               getId()          { return id; }
    public String             getName()        { return name; }
    public String             getDescription() { return description; }
    public PipelineStatus     getStatus()      { return status; }
    public Instant            getCreatedAt()   { return createdAt; }
    public Instant            getUpdatedAt()   { return updatedAt; }
    public List<PipelineStep> getSteps()       { return steps; }

    public Map<String, Object> getConfig() {
        return config == null ? Map.of() : config;
    }

    public void setName(String name)                   { this.name = name; }
    public void setDescription(String description)     { this.description = description; }
    public void setStatus(PipelineStatus status)       { this.status = status; }
    public void setConfig(Map<String, Object> config)  { this.config = new LinkedHashMap<>(config); }

    public PipelineStep addStep(UUID agentId, int order, Map<String, Object> stepConfig) {
        PipelineStep step = new PipelineStep(this, agentId, order, stepConfig);
        steps.add(step);
        return step;
    }

    public boolean removeStep(UUID stepId) {
        return steps.removeIf(s -> stepId.equals(s.getId()));
    }

    public boolean hasStepWithOrder(int order) {
        return steps.stream().anyMatch(s -> s.getStepOrder() == order);
    }
}
