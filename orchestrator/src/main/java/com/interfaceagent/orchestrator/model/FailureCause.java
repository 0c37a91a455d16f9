package com.interfaceagent.orchestrator.model;

/**
 * Why a Pipeline Execution ended FAILED.
 */
public enum FailureCause {
    STEP_FAILED,    // a critical step failed (fail-fast)
    CANCELLED,      // cancelled between steps
    INTERRUPTED,    // the owning process died mid-run; set by the reaper
    INTERNAL_ERROR  // unexpected exception in the runner itself
}
