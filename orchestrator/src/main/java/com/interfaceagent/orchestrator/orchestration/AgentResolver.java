package com.interfaceagent.orchestrator.orchestration;

import com.interfaceagent.orchestrator.agent.Agent;
import com.interfaceagent.orchestrator.agent.AgentRegistry;
import com.interfaceagent.orchestrator.agent.AgentRegistryException;
import com.interfaceagent.orchestrator.model.AgentDefinition;
import com.interfaceagent.orchestrator.plugin.PluginException;
import com.interfaceagent.orchestrator.plugin.PluginLoader;
import com.interfaceagent.orchestrator.repository.AgentDefinitionRepository;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns a step's agent reference into a ready agent instance.
 *
 * The definition must exist and be ACTIVE. Its type is looked up in the
 * registry; plugin-backed definitions whose type is not registered yet are
 * loaded through the Plugin Loader first. Every failure is reported as
 * AGENT_UNAVAILABLE so the step, not the execution, absorbs it.
 */
@Component
public class AgentResolver {

    public record ResolvedAgent(AgentDefinition definition, Agent agent) {}

    private final AgentDefinitionRepository agents;
    private final AgentRegistry             registry;
    private final PluginLoader              pluginLoader;

    public AgentResolver(AgentDefinitionRepository agents, AgentRegistry registry, PluginLoader pluginLoader) {
        this.agents       = agents;
        this.registry     = registry;
        this.pluginLoader = pluginLoader;
    }

    /**
     * @throws OrchestrationException AGENT_UNAVAILABLE
     */
    public ResolvedAgent resolve(PipelineSnapshot.StepSnapshot step) {
        AgentDefinition definition = agents.findById(step.agentId()).orElseThrow(() ->
                unavailable("Agent " + step.agentId() + " does not exist", null));
        if (!definition.isActive()) {
            throw unavailable("Agent '" + definition.getName() + "' is " + definition.getStatus(), null);
        }

        Map<String, Object> config = StepPolicy.agentConfig(definition.getConfig(), step.config());
        try {
            if (definition.isPlugin() && !registry.contains(definition.getAgentType())) {
                pluginLoader.load(definition.getPluginModule(), definition.getPluginSymbol(),
                        definition.getAgentType(), Map.of());
            }
            return new ResolvedAgent(definition, registry.createAgent(definition.getAgentType(), config));
        } catch (AgentRegistryException | PluginException e) {
            throw unavailable("Agent '" + definition.getName() + "' cannot be instantiated: " + e.getMessage(), e);
        }
    }

    private static OrchestrationException unavailable(String message, Throwable cause) {
        return new OrchestrationException(OrchestrationException.Kind.AGENT_UNAVAILABLE, message, cause);
    }
}
