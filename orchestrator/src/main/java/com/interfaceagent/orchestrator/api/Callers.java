package com.interfaceagent.orchestrator.api;

import com.interfaceagent.orchestrator.audit.Caller;
import com.interfaceagent.orchestrator.model.AuditRecord;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Builds the audit {@link Caller} from a request.
 *
 * Authentication happens in front of this service; the authenticated user id
 * arrives in the {@code X-Actor} header.
 */
final class Callers {

    static final String ACTOR_HEADER = "X-Actor";
    static final String ANONYMOUS    = "anonymous";

    private Callers() {}

    static Caller from(HttpServletRequest request) {
        String actor = request.getHeader(ACTOR_HEADER);
        if (actor == null || actor.isBlank()) actor = ANONYMOUS;

        String userAgent = request.getHeader("User-Agent");
        String origin = request.getRemoteAddr();
        if (userAgent != null && !userAgent.isBlank()) {
            origin = origin == null ? userAgent : origin + " " + userAgent;
        }
        // pipeline_executions.requested_by has the same width as audit_records.actor.
        return new Caller(AuditRecord.clip(actor.trim(), AuditRecord.ACTOR_LENGTH),
                AuditRecord.clip(origin, AuditRecord.ORIGIN_LENGTH));
    }
}
