package com.interfaceagent.orchestrator.plugin.fixtures;

import com.interfaceagent.orchestrator.agent.Agent;

import java.util.LinkedHashMap;
import java.util.Map;

/** Plugin that implements the agent contract directly. */
public class EchoAgentPlugin implements Agent {

    @Override
    public Map<String, Object> execute(Map<String, Object> data) {
        Map<String, Object> out = new LinkedHashMap<>(data);
        out.put("echoedBy", getClass().getClassLoader() == Agent.class.getClassLoader() ? "service" : "plugin");
        return out;
    }
}
