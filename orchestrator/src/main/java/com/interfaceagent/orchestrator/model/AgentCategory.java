package com.interfaceagent.orchestrator.model;

/**
 * What kind of processing an agent performs. Informational only:
 * the orchestrator treats every category the same way.
 */
public enum AgentCategory {
    VALIDATOR,
    ANALYZER,
    ENRICHER,
    TRANSFORMER,
    CUSTOM
}
