package com.interfaceagent.orchestrator.model;

/**
 * Why a step result is FAILED.
 */
public enum StepFailureKind {
    VALIDATION_FAILED,  // validateInput() returned false; execute() never ran
    PROCESSING_FAILED,  // execute() threw
    TIMEOUT,            // execute() exceeded the step timeout
    AGENT_UNAVAILABLE   // the bound agent could not be resolved or is not ACTIVE
}
