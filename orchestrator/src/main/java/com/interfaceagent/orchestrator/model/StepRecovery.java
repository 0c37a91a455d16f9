package com.interfaceagent.orchestrator.model;

/**
 * Outcome of the agent's onError() hook for a failed step.
 *
 * NONE        : the hook was not invoked (success, validation failure, unresolved agent)
 * RECOVERED   : the hook ran and returned normally
 * UNRECOVERED : the hook itself threw; the exception was logged and dropped
 */
public enum StepRecovery {
    NONE,
    RECOVERED,
    UNRECOVERED
}
