package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.model.AgentCategory;
import com.interfaceagent.orchestrator.model.AgentDefinition;
import com.interfaceagent.orchestrator.model.AgentStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

public record AgentResponse(
        UUID                id,
        String              name,
        String              description,
        String              agentType,
        AgentCategory       category,
        String              version,
        AgentStatus         status,
        Map<String, Object> config,
        boolean             plugin,
        String              pluginModule,
        String              pluginSymbol,
        Instant             createdAt,
        Instant             updatedAt
) {
    public static AgentResponse from(AgentDefinition a) {
        return new AgentResponse(
                a.getId(),
                a.getName(),
                a.getDescription(),
                a.getAgentType(),
                a.getCategory(),
                a.getVersion(),
                a.getStatus(),
                a.getConfig(),
                a.isPlugin(),
                a.getPluginModule(),
                a.getPluginSymbol(),
                a.getCreatedAt(),
                a.getUpdatedAt()
        );
    }
}
