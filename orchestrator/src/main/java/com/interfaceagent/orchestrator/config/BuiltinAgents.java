package com.interfaceagent.orchestrator.config;

import com.interfaceagent.orchestrator.agent.AgentRegistration;
import com.interfaceagent.orchestrator.agent.impl.AnalyzerAgent;
import com.interfaceagent.orchestrator.agent.impl.EnricherAgent;
import com.interfaceagent.orchestrator.agent.impl.TransformerAgent;
import com.interfaceagent.orchestrator.agent.impl.ValidatorAgent;
import com.interfaceagent.orchestrator.model.AgentCategory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registrations for the agent types that ship with the service.
 * {@code AgentRegistry} picks up every {@link AgentRegistration} bean at startup.
 *
 * All four are pure functions of (config, input), so one instance per
 * configuration can serve concurrent executions.
 */
@Configuration
public class BuiltinAgents {

    @Bean
    public AgentRegistration validatorAgent() {
        return new AgentRegistration(ValidatorAgent.TYPE, AgentCategory.VALIDATOR, "1.0.0", true, ValidatorAgent::new);
    }

    @Bean
    public AgentRegistration analyzerAgent() {
        return new AgentRegistration(AnalyzerAgent.TYPE, AgentCategory.ANALYZER, "1.0.0", true, AnalyzerAgent::new);
    }

    @Bean
    public AgentRegistration enricherAgent() {
        return new AgentRegistration(EnricherAgent.TYPE, AgentCategory.ENRICHER, EnricherAgent.VERSION, true, EnricherAgent::new);
    }

    @Bean
    public AgentRegistration transformerAgent() {
        return new AgentRegistration(TransformerAgent.TYPE, AgentCategory.TRANSFORMER, "1.0.0", true, TransformerAgent::new);
    }
}
