package com.interfaceagent.orchestrator.model;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
