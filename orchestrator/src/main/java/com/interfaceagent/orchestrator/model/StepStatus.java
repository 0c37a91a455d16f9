package com.interfaceagent.orchestrator.model;

/**
 * Terminal status of one step within an execution. Step results are only
 * written once the step has finished, so there is no RUNNING value.
 */
public enum StepStatus {
    SUCCEEDED,
    FAILED
}
