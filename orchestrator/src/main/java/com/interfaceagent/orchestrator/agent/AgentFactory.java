package com.interfaceagent.orchestrator.agent;

import java.util.Map;

/**
 * Constructs an agent bound to a configuration. The map passed in is a
 * private copy; the factory may keep it.
 */
@FunctionalInterface
public interface AgentFactory {

    Agent create(Map<String, Object> config);
}
