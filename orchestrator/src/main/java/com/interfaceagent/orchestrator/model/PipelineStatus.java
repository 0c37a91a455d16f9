package com.interfaceagent.orchestrator.model;

/**
 * Lifecycle of a Pipeline Definition.
 *
 *   DRAFT → ACTIVE ⇄ PAUSED → ARCHIVED
 *
 * Only ACTIVE pipelines accept new executions.
 */
public enum PipelineStatus {
    DRAFT,
    ACTIVE,
    PAUSED,
    ARCHIVED
}
