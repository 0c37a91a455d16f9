package com.interfaceagent.orchestrator.service;

import com.interfaceagent.orchestrator.model.PipelineStatus;

import java.util.Map;

/** Partial update of a pipeline; null fields are left unchanged. */
public record PipelineChanges(String name, String description, PipelineStatus status, Map<String, Object> config) {}
