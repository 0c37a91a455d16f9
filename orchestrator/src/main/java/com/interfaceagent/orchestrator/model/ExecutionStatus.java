package com.interfaceagent.orchestrator.model;

/**
 * States of one Pipeline Execution.
 *
 * Transitions:
 *   PENDING → RUNNING                     (accepted by the orchestrator)
 *   RUNNING → SUCCEEDED                   (every step succeeded)
 *   RUNNING → FAILED                      (a critical step failed, or cancelled)
 *   RUNNING → PARTIALLY_FAILED            (only non-critical steps failed)
 *
 * PENDING is never persisted: the row is written already RUNNING.
 */
public enum ExecutionStatus {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    PARTIALLY_FAILED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == PARTIALLY_FAILED;
    }
}
