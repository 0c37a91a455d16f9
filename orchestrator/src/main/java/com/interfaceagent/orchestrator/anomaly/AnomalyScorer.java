package com.interfaceagent.orchestrator.anomaly;

import java.util.Map;

/**
 * Scores event payloads. {@link #score} has no side effects; the model only
 * changes through {@link #observe}.
 */
public interface AnomalyScorer {

    AnomalyScore score(Map<String, Object> data);

    /** Feed one payload into the model. */
    default void observe(Map<String, Object> data) {
    }
}
