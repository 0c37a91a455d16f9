package com.interfaceagent.orchestrator.model;

public enum AuditStatus {
    SUCCESS,
    FAILURE
}
