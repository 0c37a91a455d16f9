package com.interfaceagent.orchestrator.service;

import com.interfaceagent.orchestrator.agent.AgentRegistration;
import com.interfaceagent.orchestrator.agent.AgentRegistry;
import com.interfaceagent.orchestrator.audit.AuditLogger;
import com.interfaceagent.orchestrator.audit.Caller;
import com.interfaceagent.orchestrator.event.DomainEvent;
import com.interfaceagent.orchestrator.event.EventBus;
import com.interfaceagent.orchestrator.event.EventBusException;
import com.interfaceagent.orchestrator.event.EventTypes;
import com.interfaceagent.orchestrator.model.AgentCategory;
import com.interfaceagent.orchestrator.model.AgentDefinition;
import com.interfaceagent.orchestrator.model.AgentStatus;
import com.interfaceagent.orchestrator.model.AuditStatus;
import com.interfaceagent.orchestrator.orchestration.OrchestrationException;
import com.interfaceagent.orchestrator.repository.AgentDefinitionRepository;
import com.interfaceagent.orchestrator.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Agent definition lifecycle: create, update, activate/deactivate, delete.
 *
 * Every mutation is audited with its outcome. Activation changes are also
 * published as {@code agent.activated} / {@code agent.deactivated}; a bus
 * failure there is logged and does not undo the change.
 */
@Service
public class AgentService {

    private static final Logger log = LoggerFactory.getLogger(AgentService.class);

    private static final String RESOURCE = "agent";

    private final AgentDefinitionRepository agents;
    private final PipelineRepository        pipelines;
    private final AgentRegistry             registry;
    private final EventBus                  eventBus;
    private final AuditLogger               auditLogger;

    public AgentService(AgentDefinitionRepository agents,
                        PipelineRepository pipelines,
                        AgentRegistry registry,
                        EventBus eventBus,
                        AuditLogger auditLogger) {
        this.agents      = agents;
        this.pipelines   = pipelines;
        this.registry    = registry;
        this.eventBus    = eventBus;
        this.auditLogger = auditLogger;
    }

    // ------------------------------------------------------------------
    // Create / update
    // ------------------------------------------------------------------

    /**
     * Create an INACTIVE agent definition.
     *
     * @throws OrchestrationException DUPLICATE_NAME, or UNKNOWN_AGENT_TYPE when the
     *         type is neither registered nor backed by a plugin
     */
    public AgentDefinition create(AgentDraft draft, Caller caller) {
        return audited(caller, "agent.create", null, Map.of("name", String.valueOf(draft.name())), () -> {
            requireText(draft.name(), "name");
            requireText(draft.agentType(), "agentType");
            if (agents.existsByName(draft.name())) {
                throw new OrchestrationException(OrchestrationException.Kind.DUPLICATE_NAME,
                        "An agent named '" + draft.name() + "' already exists");
            }

            AgentCategory category = draft.category();
            String version = draft.version();
            if (draft.isPlugin()) {
                requireText(draft.pluginSymbol(), "pluginSymbol");
            } else {
                AgentRegistration registration = registry.find(draft.agentType()).orElseThrow(() ->
                        new OrchestrationException(OrchestrationException.Kind.UNKNOWN_AGENT_TYPE,
                                "No agent type registered with name '" + draft.agentType() + "'"));
                if (category == null) category = registration.category();
                if (version == null) version = registration.version();
            }

            AgentDefinition agent = new AgentDefinition(draft.name(), draft.agentType(),
                    category == null ? AgentCategory.CUSTOM : category);
            agent.setDescription(draft.description());
            if (version != null) agent.setVersion(version);
            if (draft.config() != null) agent.setConfig(draft.config());
            if (draft.isPlugin()) agent.bindPlugin(draft.pluginModule(), draft.pluginSymbol());

            AgentDefinition saved = agents.save(agent);
            log.info("Created agent '{}' ({}) of type '{}'", saved.getName(), saved.getId(), saved.getAgentType());
            return saved;
        });
    }

    public AgentDefinition update(UUID id, AgentChanges changes, Caller caller) {
        return audited(caller, "agent.update", id, Map.of(), () -> {
            AgentDefinition agent = require(id);
            if (changes.name() != null && !changes.name().equals(agent.getName())) {
                requireText(changes.name(), "name");
                if (agents.existsByName(changes.name())) {
                    throw new OrchestrationException(OrchestrationException.Kind.DUPLICATE_NAME,
                            "An agent named '" + changes.name() + "' already exists");
                }
                agent.setName(changes.name());
            }
            if (changes.description() != null) agent.setDescription(changes.description());
            if (changes.version() != null)     agent.setVersion(changes.version());
            if (changes.config() != null)      agent.setConfig(changes.config());
            AgentDefinition saved = agents.save(agent);
            // Cached reentrant instances are keyed by config; the old one is unreachable now.
            if (changes.config() != null)      registry.evictInstances(agent.getAgentType());
            return saved;
        });
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    public AgentDefinition activate(UUID id, Caller caller) {
        return changeStatus(id, AgentStatus.ACTIVE, "agent.activate", EventTypes.AGENT_ACTIVATED, caller);
    }

    public AgentDefinition deactivate(UUID id, Caller caller) {
        return changeStatus(id, AgentStatus.INACTIVE, "agent.deactivate", EventTypes.AGENT_DEACTIVATED, caller);
    }

    private AgentDefinition changeStatus(UUID id, AgentStatus target, String action, String eventType, Caller caller) {
        AgentDefinition agent = audited(caller, action, id, Map.of("status", target.name()), () -> {
            AgentDefinition a = require(id);
            a.setStatus(target);
            return agents.save(a);
        });
        log.info("Agent '{}' is now {}", agent.getName(), target);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agentId", agent.getId().toString());
        payload.put("name", agent.getName());
        payload.put("agentType", agent.getAgentType());
        payload.put("actor", caller.actor());
        try {
            eventBus.publish(DomainEvent.of(UUID.randomUUID().toString(), eventType, payload, null, RESOURCE));
        } catch (EventBusException e) {
            log.warn("EventPublishDegraded: {} for agent {} was not published: {}", eventType, id, e.getMessage());
        }
        return agent;
    }

    // ------------------------------------------------------------------
    // Delete
    // ------------------------------------------------------------------

    /**
     * @throws OrchestrationException AGENT_IN_USE while any pipeline step references the agent
     */
    public void delete(UUID id, Caller caller) {
        audited(caller, "agent.delete", id, Map.of(), () -> {
            AgentDefinition agent = require(id);
            if (pipelines.isAgentReferenced(id)) {
                throw new OrchestrationException(OrchestrationException.Kind.AGENT_IN_USE,
                        "Agent '" + agent.getName() + "' is used by at least one pipeline step");
            }
            agents.delete(agent);
            registry.evictInstances(agent.getAgentType());
            log.info("Deleted agent '{}' ({})", agent.getName(), id);
            return agent;
        });
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public AgentDefinition get(UUID id) {
        return require(id);
    }

    public List<AgentDefinition> list() {
        return agents.findAll(Sort.by("name"));
    }

    public List<AgentRegistration> registeredTypes() {
        return registry.registrations();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private AgentDefinition require(UUID id) {
        return agents.findById(id).orElseThrow(() ->
                new OrchestrationException(OrchestrationException.Kind.AGENT_NOT_FOUND, "Agent " + id + " not found"));
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    // Runs the mutation and audits its outcome; the resource id of a create is known only afterwards.
    private AgentDefinition audited(Caller caller, String action, UUID id, Map<String, Object> details,
                                    Supplier<AgentDefinition> mutation) {
        try {
            AgentDefinition result = mutation.get();
            auditLogger.record(caller.actor(), action, RESOURCE, result.getId(), AuditStatus.SUCCESS,
                    details, caller.origin());
            return result;
        } catch (RuntimeException e) {
            Map<String, Object> failure = new LinkedHashMap<>(details);
            failure.put("error", String.valueOf(e.getMessage()));
            auditLogger.record(caller.actor(), action, RESOURCE, id, AuditStatus.FAILURE, failure, caller.origin());
            throw e;
        }
    }
}
