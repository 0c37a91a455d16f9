package com.interfaceagent.orchestrator.api.dto;

import java.util.Map;

/**
 * Request body for POST /plugins.
 *
 * moduleRef: jar path, class directory, or "classpath:"
 * symbol:    fully qualified class name inside the module
 * typeName:  registry key to bind the loaded implementation to
 */
public record PluginLoadRequest(String moduleRef, String symbol, String typeName, Map<String, Object> config) {}
