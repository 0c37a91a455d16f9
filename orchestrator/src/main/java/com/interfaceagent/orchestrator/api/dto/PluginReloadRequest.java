package com.interfaceagent.orchestrator.api.dto;

/** Request body for POST /plugins/reload and POST /plugins/unload. */
public record PluginReloadRequest(String moduleRef, String symbol) {}
