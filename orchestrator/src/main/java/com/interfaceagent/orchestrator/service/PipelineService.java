package com.interfaceagent.orchestrator.service;

import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.audit.Caller;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.model.PipelineDefinition;
import com.interfaceagent.orchestrator.model.PipelineStep;
import com.interfaceagent.orchestrator.orchestration.MergeStrategy;
import com.interfaceagent.orchestrator.orchestration.OrchestrationException;
import com.interfaceagent.orchestrator.orchestration.StepPolicy;
import com.interfaceagent.orchestrator.repository.AgentDefinitionRepository;
import com.interfaceagent.orchestrator.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Pipeline definitions and their steps.
 *
 * Edits never reach an execution that is already running: the orchestrator
 * works from a snapshot taken when the execution was accepted.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private static final String RESOURCE = "pipeline";

    private final PipelineRepository        pipelines;
    private final AgentDefinitionRepository agents;
    private final AuditLogger               auditLogger;
    private final Duration                  defaultStepTimeout;
    private final Duration                  staleAfter;

    public PipelineService(PipelineRepository pipelines,
                           AgentDefinitionRepository agents,
                           AuditLogger auditLogger,
                           @Value("${interface-agent.execution.default-step-timeout:30s}") Duration defaultStepTimeout,
                           @Value("${interface-agent.execution.stale-after:10m}") Duration staleAfter) {
        this.pipelines          = pipelines;
        this.agents             = agents;
        this.auditLogger        = auditLogger;
        this.defaultStepTimeout = defaultStepTimeout;
        this.staleAfter         = staleAfter;
    }

    // ------------------------------------------------------------------
    // Pipelines
    // ------------------------------------------------------------------

    /** Create a DRAFT pipeline. */
    public PipelineDefinition create(String name, String description, Map<String, Object> config, Caller caller) {
        try {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            if (pipelines.existsByName(name)) {
                throw new OrchestrationException(OrchestrationException.Kind.DUPLICATE_NAME,
                        "A pipeline named '" + name + "' already exists");
            }
            PipelineDefinition pipeline = new PipelineDefinition(name, description);
            if (config != null) {
                MergeStrategy.fromConfig(config);
                pipeline.setConfig(config);
            }
            PipelineDefinition saved = pipelines.save(pipeline);
            audit(caller, "pipeline.create", saved.getId(), AuditStatus.SUCCESS, Map.of("name", name));
            log.info("Created pipeline '{}' ({})", name, saved.getId());
            return saved;
        } catch (RuntimeException e) {
            audit(caller, "pipeline.create", null, AuditStatus.FAILURE, failure(e));
            throw e;
        }
    }

    @Transactional
    public PipelineDefinition update(UUID id, PipelineChanges changes, Caller caller) {
        try {
            PipelineDefinition pipeline = require(id);
            if (changes.name() != null && !changes.name().equals(pipeline.getName())) {
                if (changes.name().isBlank()) {
                    throw new IllegalArgumentException("name must not be blank");
                }
                if (pipelines.existsByName(changes.name())) {
                    throw new OrchestrationException(OrchestrationException.Kind.DUPLICATE_NAME,
                            "A pipeline named '" + changes.name() + "' already exists");
                }
                pipeline.setName(changes.name());
            }
            if (changes.description() != null) pipeline.setDescription(changes.description());
            if (changes.config() != null) {
                MergeStrategy.fromConfig(changes.config());
                pipeline.setConfig(changes.config());
            }
            if (changes.status() != null && changes.status() != pipeline.getStatus()) {
                log.info("Pipeline '{}' {} -> {}", pipeline.getName(), pipeline.getStatus(), changes.status());
                pipeline.setStatus(changes.status());
            }
            PipelineDefinition saved = pipelines.save(pipeline);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", saved.getStatus().name());
            audit(caller, "pipeline.update", id, AuditStatus.SUCCESS, details);
            return saved;
        } catch (RuntimeException e) {
            audit(caller, "pipeline.update", id, AuditStatus.FAILURE, failure(e));
            throw e;
        }
    }

    public void delete(UUID id, Caller caller) {
        try {
            PipelineDefinition pipeline = require(id);
            pipelines.delete(pipeline);
            audit(caller, "pipeline.delete", id, AuditStatus.SUCCESS, Map.of("name", pipeline.getName()));
            log.info("Deleted pipeline '{}' ({})", pipeline.getName(), id);
        } catch (RuntimeException e) {
            audit(caller, "pipeline.delete", id, AuditStatus.FAILURE, failure(e));
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Steps
    // ------------------------------------------------------------------

    /**
     * Append a step bound to {@code agentId} at position {@code order}.
     *
     * @throws OrchestrationException PIPELINE_NOT_FOUND, AGENT_NOT_FOUND, or
     *         STEP_ORDER_CONFLICT if the order is already taken
     * @throws IllegalArgumentException malformed {@code critical} / {@code timeout_ms}, or a
     *         timeout that reaches the stale-after window
     */
    @Transactional
    public PipelineStep addStep(UUID pipelineId, UUID agentId, int order, Map<String, Object> config, Caller caller) {
        try {
            PipelineDefinition pipeline = requireWithSteps(pipelineId);
            if (!agents.existsById(agentId)) {
                throw new OrchestrationException(OrchestrationException.Kind.AGENT_NOT_FOUND,
                        "Agent " + agentId + " not found");
            }
            if (pipeline.hasStepWithOrder(order)) {
                throw new OrchestrationException(OrchestrationException.Kind.STEP_ORDER_CONFLICT,
                        "Pipeline '" + pipeline.getName() + "' already has a step with order " + order);
            }
            Map<String, Object> stepConfig = config == null ? Map.of() : config;
            StepPolicy policy = StepPolicy.from(stepConfig, defaultStepTimeout);
            if (policy.timeout().compareTo(staleAfter) >= 0) {
                throw new IllegalArgumentException("timeout_ms must be below the stale-after window of "
                        + staleAfter.toMillis() + " ms, got " + policy.timeout().toMillis());
            }

            PipelineStep step = pipeline.addStep(agentId, order, stepConfig);
            pipelines.saveAndFlush(pipeline);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stepId", String.valueOf(step.getId()));
            details.put("agentId", agentId.toString());
            details.put("order", order);
            audit(caller, "pipeline.step.add", pipelineId, AuditStatus.SUCCESS, details);
            log.info("Pipeline '{}': added step {} -> agent {}", pipeline.getName(), order, agentId);
            return step;
        } catch (RuntimeException e) {
            audit(caller, "pipeline.step.add", pipelineId, AuditStatus.FAILURE, failure(e));
            throw e;
        }
    }

    @Transactional
    public void removeStep(UUID pipelineId, UUID stepId, Caller caller) {
        try {
            PipelineDefinition pipeline = requireWithSteps(pipelineId);
            if (!pipeline.removeStep(stepId)) {
                throw new OrchestrationException(OrchestrationException.Kind.STEP_NOT_FOUND,
                        "Pipeline '" + pipeline.getName() + "' has no step " + stepId);
            }
            pipelines.save(pipeline);
            audit(caller, "pipeline.step.remove", pipelineId, AuditStatus.SUCCESS, Map.of("stepId", stepId.toString()));
        } catch (RuntimeException e) {
            audit(caller, "pipeline.step.remove", pipelineId, AuditStatus.FAILURE, failure(e));
            throw e;
        }
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public PipelineDefinition get(UUID id) {
        return requireWithSteps(id);
    }

    public List<PipelineDefinition> list() {
        return pipelines.findAll(Sort.by("name"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private PipelineDefinition require(UUID id) {
        return pipelines.findById(id).orElseThrow(() -> notFound(id));
    }

    private PipelineDefinition requireWithSteps(UUID id) {
        return pipelines.findWithStepsById(id).orElseThrow(() -> notFound(id));
    }

    private static OrchestrationException notFound(UUID id) {
        return new OrchestrationException(OrchestrationException.Kind.PIPELINE_NOT_FOUND, "Pipeline " + id + " not found");
    }

    private void audit(Caller caller, String action, UUID id, AuditStatus status, Map<String, Object> details) {
        auditLogger.record(caller.actor(), action, RESOURCE, id, status, details, caller.origin());
    }

    private static Map<String, Object> failure(RuntimeException e) {
        return Map.of("error", String.valueOf(e.getMessage()));
    }
}
