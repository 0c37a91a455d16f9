package com.interfaceagent.orchestrator.api.dto;

import com.interfaceagent.orchestrator.agent.AgentRegistration;
import com.interfaceagent.orchestrator.model.AgentCategory;

/** One entry of GET /agents/types. */
public record AgentTypeResponse(String typeName, AgentCategory category, String version, boolean reentrant) {

    public static AgentTypeResponse from(AgentRegistration r) {
        return new AgentTypeResponse(r.typeName(), r.category(), r.version(), r.reentrant());
    }
}
