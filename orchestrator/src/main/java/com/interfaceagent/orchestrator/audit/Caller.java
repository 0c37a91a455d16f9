package com.interfaceagent.orchestrator.audit;

/**
 * Who asked for an operation, as recorded in the audit trail.
 *
 * @param actor  user id, or {@value AuditLogger#SYSTEM_ACTOR}
 * @param origin remote address and user agent of the request, when known
 */
public record Caller(String actor, String origin) {

    public static Caller system() {
        return new Caller(AuditLogger.SYSTEM_ACTOR, null);
    }
}
