package com.interfaceagent.orchestrator.anomaly;

import com.interfaceagent.orchestrator.model.AnomalySeverity;

/**
 * @param anomalous true if {@code score} exceeded the threshold
 * @param severity  meaningful only when anomalous
 * @param score     model-specific magnitude (for the statistical scorer: max |z|)
 */
public record AnomalyScore(boolean anomalous, AnomalySeverity severity, double score) {

    public static AnomalyScore normal(double score) {
        return new AnomalyScore(false, AnomalySeverity.LOW, score);
    }
}
