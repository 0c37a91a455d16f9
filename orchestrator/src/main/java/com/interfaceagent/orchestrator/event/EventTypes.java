package com.interfaceagent.orchestrator.event;

/** Event type names published on the bus. */
public final class EventTypes {

    public static final String AGENT_ACTIVATED     = "agent.activated";
    public static final String AGENT_DEACTIVATED   = "agent.deactivated";
    public static final String STEP_STARTED        = "pipeline.step.started";
    public static final String STEP_SUCCEEDED      = "pipeline.step.succeeded";
    public static final String STEP_FAILED         = "pipeline.step.failed";
    public static final String EXECUTION_COMPLETED = "pipeline.execution.completed";
    public static final String ANOMALY_DETECTED    = "anomaly.detected";

    private EventTypes() {}

    /** Deterministic id of a step event, so a re-published copy dedups. */
    public static String stepEventId(Object executionId, int stepOrder, String type) {
        return executionId + ":" + stepOrder + ":" + type;
    }

    public static String completionEventId(Object executionId) {
        return executionId + ":" + EXECUTION_COMPLETED;
    }
}
